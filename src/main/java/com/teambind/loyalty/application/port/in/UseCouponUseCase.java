package com.teambind.loyalty.application.port.in;

/**
 * 앱 내 쿠폰 직접 사용 유스케이스
 */
public interface UseCouponUseCase {

    CouponOperationResult useDirectly(UseCouponCommand command);
}
