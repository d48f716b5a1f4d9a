package com.teambind.loyalty.domain.service;

import com.teambind.loyalty.domain.model.Coupon;
import com.teambind.loyalty.domain.model.CouponHistory;
import com.teambind.loyalty.domain.model.CouponStore;
import com.teambind.loyalty.domain.model.CouponStoreLimits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 적재 직후 저장소 보정
 *
 * 1. 비밀 코드가 없는 구버전 쿠폰에 코드 부여
 * 2. 만료된 미사용 쿠폰을 사용 처리하고 만료 이력을 기존 이력 앞에 추가
 *
 * 보정이 적용된 저장소를 다시 보정하면 변경이 없습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class CouponStoreRepairer {

    private final SecretCodeGenerator secretCodeGenerator;
    private final CouponHistoryRecorder historyRecorder;

    public RepairResult repair(CouponStore store, Instant now, CouponStoreLimits limits) {
        List<Coupon> repaired = new ArrayList<>(store.getCoupons().size());
        List<CouponHistory> expireEntries = new ArrayList<>();
        int backfilled = 0;

        for (Coupon coupon : store.getCoupons()) {
            Coupon current = coupon;

            if (!current.hasSecretCode()) {
                current = current.withSecretCode(secretCodeGenerator.generate());
                backfilled++;
            }

            if (current.isExpiredAt(now)) {
                current = current.expire();
                expireEntries.add(historyRecorder.expired(current));
            }

            repaired.add(current);
        }

        if (backfilled == 0 && expireEntries.isEmpty()) {
            return new RepairResult(store, 0, 0);
        }

        expireEntries.sort(Comparator.comparing(CouponHistory::getTimestamp).reversed());
        log.info("쿠폰 저장소 보정 - 코드 부여: {}, 만료 처리: {}", backfilled, expireEntries.size());

        return new RepairResult(store.withRepairs(repaired, expireEntries, limits), backfilled, expireEntries.size());
    }

    /**
     * 보정 결과
     */
    public record RepairResult(CouponStore store, int backfilledCodes, int expiredCoupons) {

        public boolean changed() {
            return backfilledCodes > 0 || expiredCoupons > 0;
        }
    }
}
