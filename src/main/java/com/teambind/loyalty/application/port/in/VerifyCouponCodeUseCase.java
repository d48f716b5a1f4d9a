package com.teambind.loyalty.application.port.in;

/**
 * 비밀 코드 검증 및 사용 유스케이스
 * 연속 실패 시 일정 시간 잠금됩니다.
 */
public interface VerifyCouponCodeUseCase {

    CouponOperationResult verifyByCode(VerifyCouponCodeCommand command);
}
