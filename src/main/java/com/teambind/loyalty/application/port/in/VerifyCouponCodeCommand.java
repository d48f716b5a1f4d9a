package com.teambind.loyalty.application.port.in;

import com.teambind.loyalty.common.SelfValidating;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 비밀 코드 검증 커맨드
 * 입력은 구분자 유무, 대소문자와 무관하게 받습니다.
 */
@Getter
@ToString(exclude = "rawCode")
@EqualsAndHashCode(callSuper = false)
public class VerifyCouponCodeCommand extends SelfValidating<VerifyCouponCodeCommand> {

    @NotNull(message = "쿠폰 코드는 필수입니다")
    @Size(max = 64, message = "쿠폰 코드가 너무 깁니다")
    private final String rawCode;

    public VerifyCouponCodeCommand(String rawCode) {
        this.rawCode = rawCode;
        validateSelf();
    }

    public static VerifyCouponCodeCommand of(String rawCode) {
        return new VerifyCouponCodeCommand(rawCode);
    }
}
