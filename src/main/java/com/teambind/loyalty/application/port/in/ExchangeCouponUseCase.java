package com.teambind.loyalty.application.port.in;

/**
 * 포인트로 쿠폰 교환 유스케이스
 */
public interface ExchangeCouponUseCase {

    CouponOperationResult exchange(ExchangeCouponCommand command);
}
