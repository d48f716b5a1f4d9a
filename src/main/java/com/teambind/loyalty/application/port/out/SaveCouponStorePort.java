package com.teambind.loyalty.application.port.out;

import com.teambind.loyalty.domain.model.CouponStore;

/**
 * 쿠폰 저장소 저장 포트
 */
public interface SaveCouponStorePort {

    /**
     * 저장 후 재조회 검증까지 성공해야 true
     * false 인 경우 호출자는 내구성을 가정하면 안 됩니다.
     */
    boolean save(CouponStore store);
}
