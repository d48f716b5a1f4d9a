package com.teambind.loyalty.application.port.in;

import com.teambind.loyalty.domain.exception.CouponErrorCode;
import com.teambind.loyalty.domain.model.Coupon;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * 쿠폰 연산 결과
 * 실패도 예외가 아닌 이 값으로 전달됩니다.
 */
@Value
@Builder
public class CouponOperationResult {

    boolean success;
    CouponErrorCode errorCode;
    String message;
    Coupon coupon;

    // 코드 검증 실패 시 남은 시도 횟수
    Integer remainingAttempts;

    // 잠금 중일 때 남은 시간
    Duration remainingLockout;

    // 저장 실패 후 보상 환불 성공 여부
    boolean refunded;

    public static CouponOperationResult success(Coupon coupon, String message) {
        return CouponOperationResult.builder()
                .success(true)
                .coupon(coupon)
                .message(message)
                .build();
    }

    public static CouponOperationResult failure(CouponErrorCode errorCode) {
        return failure(errorCode, errorCode.getDefaultMessage());
    }

    public static CouponOperationResult failure(CouponErrorCode errorCode, String message) {
        return CouponOperationResult.builder()
                .success(false)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    public Optional<Coupon> coupon() {
        return Optional.ofNullable(coupon);
    }

    public boolean hasError(CouponErrorCode code) {
        return !success && errorCode == code;
    }
}
