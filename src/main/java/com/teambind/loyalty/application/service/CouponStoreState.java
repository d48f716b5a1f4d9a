package com.teambind.loyalty.application.service;

import com.teambind.loyalty.application.port.out.LoadCouponStorePort;
import com.teambind.loyalty.domain.exception.CouponDomainException;
import com.teambind.loyalty.domain.model.CouponStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 현재 쿠폰 저장소 스냅샷
 *
 * 최초 접근 시 저장소에서 적재하고, 이후에는 영속화에 성공한 상태만 publish 됩니다.
 * 조회 측은 항상 마지막으로 저장에 성공한 상태를 봅니다.
 * 적재에 실패하면 아무것도 보관하지 않고 다음 접근에서 다시 적재합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CouponStoreState {

    private final LoadCouponStorePort loadCouponStorePort;

    private volatile CouponStore current;

    public CouponStore current() {
        CouponStore snapshot = current;
        if (snapshot == null) {
            synchronized (this) {
                snapshot = current;
                if (snapshot == null) {
                    snapshot = loadCouponStorePort.load();
                    current = snapshot;
                }
            }
        }
        return snapshot;
    }

    /**
     * 조회용 스냅샷. 적재할 수 없으면 보관하지 않은 빈 저장소를 돌려줍니다.
     */
    public CouponStore currentOrEmpty() {
        try {
            return current();
        } catch (CouponDomainException e) {
            log.warn("쿠폰 저장소 적재 실패 - 빈 목록으로 응답 - error: {}", e.getMessage());
            return CouponStore.empty();
        }
    }

    /**
     * 저장에 성공한 새 상태 공개
     */
    public void publish(CouponStore store) {
        current = store;
    }

    /**
     * 저장소에서 다시 적재 (콜드 스타트)
     */
    public synchronized CouponStore reload() {
        CouponStore loaded = loadCouponStorePort.load();
        current = loaded;
        log.info("쿠폰 저장소 적재 - coupons: {}, history: {}, totalExchanged: {}, totalUsed: {}",
                loaded.getCoupons().size(), loaded.getHistory().size(),
                loaded.getTotalExchanged(), loaded.getTotalUsed());
        return loaded;
    }
}
