/**
 * Input Port Interfaces (Use Cases)
 * 애플리케이션의 유스케이스 정의
 *
 * 주요 Use Case:
 * - ExchangeCouponUseCase: 포인트로 쿠폰 교환
 * - UseCouponUseCase: 앱 내 직접 사용
 * - VerifyCouponCodeUseCase: 비밀 코드 검증 사용
 * - GetCouponsQuery: 쿠폰/이력 조회
 */
package com.teambind.loyalty.application.port.in;
