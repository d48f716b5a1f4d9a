package com.teambind.loyalty.application.port.in;

import com.teambind.loyalty.common.SelfValidating;
import com.teambind.loyalty.domain.model.CouponKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 포인트 → 쿠폰 교환 커맨드
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class ExchangeCouponCommand extends SelfValidating<ExchangeCouponCommand> {

    @PositiveOrZero(message = "보유 포인트는 음수일 수 없습니다")
    private final long pointBalance;

    @NotNull(message = "쿠폰 종류는 필수입니다")
    private final CouponKind kind;

    public ExchangeCouponCommand(long pointBalance, CouponKind kind) {
        this.pointBalance = pointBalance;
        this.kind = kind;
        validateSelf();
    }

    public static ExchangeCouponCommand of(long pointBalance, CouponKind kind) {
        return new ExchangeCouponCommand(pointBalance, kind);
    }

    /**
     * 기본 종류(무료 이벤트 참가권) 교환
     */
    public static ExchangeCouponCommand of(long pointBalance) {
        return new ExchangeCouponCommand(pointBalance, CouponKind.FREE_EVENT);
    }
}
