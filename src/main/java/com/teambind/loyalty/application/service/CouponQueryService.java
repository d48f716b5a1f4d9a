package com.teambind.loyalty.application.service;

import com.teambind.loyalty.application.port.in.GetCouponsQuery;
import com.teambind.loyalty.common.config.CouponEngineProperties;
import com.teambind.loyalty.domain.model.Coupon;
import com.teambind.loyalty.domain.model.CouponHistory;
import com.teambind.loyalty.domain.model.CouponStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 쿠폰 조회 서비스
 * 마지막으로 저장에 성공한 스냅샷만 읽으며 락을 잡지 않습니다.
 * 저장소를 읽을 수 없으면 빈 결과를 돌려주며 그 상태를 보관하지 않습니다.
 */
@Service
@RequiredArgsConstructor
public class CouponQueryService implements GetCouponsQuery {

    private final CouponStoreState storeState;
    private final CouponEngineProperties properties;
    private final Clock clock;

    @Override
    public List<Coupon> getCoupons() {
        return storeState.currentOrEmpty().getCoupons();
    }

    @Override
    public List<Coupon> getAvailableCoupons() {
        return storeState.currentOrEmpty().availableCoupons(clock.instant());
    }

    @Override
    public List<CouponHistory> getHistory() {
        return storeState.currentOrEmpty().getHistory();
    }

    @Override
    public CouponSummary getSummary() {
        CouponStore store = storeState.currentOrEmpty();
        Instant now = clock.instant();
        return CouponSummary.builder()
                .totalExchanged(store.getTotalExchanged())
                .totalUsed(store.getTotalUsed())
                .availableCount(store.countAvailable(now))
                .storedCount(store.getCoupons().size())
                .costPerCoupon(properties.getCostPerCoupon())
                .maxLiveCoupons(properties.getMaxLiveCoupons())
                .build();
    }

    /**
     * 잔액과 보유 한도만 확인 (쿨다운은 교환 시점에 판단)
     */
    @Override
    public boolean canExchange(long pointBalance) {
        return pointBalance >= properties.getCostPerCoupon()
                && storeState.currentOrEmpty().countAvailable(clock.instant()) < properties.getMaxLiveCoupons();
    }

    @Override
    public long pointsNeededForCoupon(long pointBalance) {
        return Math.max(0L, properties.getCostPerCoupon() - pointBalance);
    }
}
