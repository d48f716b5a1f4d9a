package com.teambind.loyalty.domain.model;

/**
 * 쿠폰 상태 (조회용 파생 값)
 */
public enum CouponStatus {
    AVAILABLE,  // 미사용, 유효기간 내
    EXPIRED,    // 미사용, 유효기간 경과
    USED        // 사용 완료 (종료 상태)
}
