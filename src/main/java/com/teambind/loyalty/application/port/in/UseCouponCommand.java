package com.teambind.loyalty.application.port.in;

import com.teambind.loyalty.common.SelfValidating;
import jakarta.validation.constraints.NotBlank;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 앱 내 쿠폰 직접 사용 커맨드
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class UseCouponCommand extends SelfValidating<UseCouponCommand> {

    @NotBlank(message = "쿠폰 ID는 필수입니다")
    private final String couponId;

    public UseCouponCommand(String couponId) {
        this.couponId = couponId;
        validateSelf();
    }

    public static UseCouponCommand of(String couponId) {
        return new UseCouponCommand(couponId);
    }
}
