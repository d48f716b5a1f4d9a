package com.teambind.loyalty.application.port.in;

import com.teambind.loyalty.domain.model.Coupon;
import com.teambind.loyalty.domain.model.CouponHistory;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 쿠폰 조회 (읽기 전용 투영)
 */
public interface GetCouponsQuery {

    List<Coupon> getCoupons();

    /**
     * 미사용이면서 만료되지 않은 쿠폰
     */
    List<Coupon> getAvailableCoupons();

    /**
     * 최신 순 이력
     */
    List<CouponHistory> getHistory();

    CouponSummary getSummary();

    boolean canExchange(long pointBalance);

    long pointsNeededForCoupon(long pointBalance);

    /**
     * 쿠폰 요약
     */
    @Value
    @Builder
    class CouponSummary {
        int totalExchanged;
        int totalUsed;
        int availableCount;
        int storedCount;
        long costPerCoupon;
        int maxLiveCoupons;
    }
}
