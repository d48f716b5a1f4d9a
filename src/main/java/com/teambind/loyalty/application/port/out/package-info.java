/**
 * Output Port Interfaces
 * 외부 리소스 접근을 위한 포트 인터페이스
 *
 * 주요 Port:
 * - LoadCouponStorePort / SaveCouponStorePort: 암호화된 쿠폰 저장소
 * - LoadVerificationLockoutPort / SaveVerificationLockoutPort: 코드 검증 잠금 상태
 * - PointLedgerPort: 포인트 원장
 */
package com.teambind.loyalty.application.port.out;
