package com.teambind.loyalty.application.port.out;

import com.teambind.loyalty.domain.model.CouponStore;

/**
 * 쿠폰 저장소 조회 포트
 */
public interface LoadCouponStorePort {

    /**
     * 저장된 쿠폰 저장소를 읽고 보정하여 반환
     * 주 저장소와 백업이 모두 사용 불가능하면 빈 저장소를 반환합니다.
     */
    CouponStore load();
}
