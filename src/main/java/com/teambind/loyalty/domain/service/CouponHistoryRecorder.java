package com.teambind.loyalty.domain.service;

import com.teambind.loyalty.common.util.SnowflakeIdGenerator;
import com.teambind.loyalty.domain.model.Coupon;
import com.teambind.loyalty.domain.model.CouponHistory;
import com.teambind.loyalty.domain.model.HistoryAction;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

/**
 * 쿠폰 이력 항목 생성
 *
 * 이력은 추가 전용이며 상한 적용은 CouponStore 가 담당합니다.
 */
@RequiredArgsConstructor
public class CouponHistoryRecorder {

    private static final String HISTORY_PREFIX = "history";

    private final SnowflakeIdGenerator idGenerator;

    public CouponHistory exchanged(Coupon coupon, long pointsSpent, Instant now) {
        return CouponHistory.builder()
                .id(idGenerator.nextId(HISTORY_PREFIX))
                .action(HistoryAction.EXCHANGE)
                .couponId(coupon.getId())
                .couponName(coupon.getName())
                .pointsSpent(pointsSpent)
                .timestamp(now)
                .build();
    }

    public CouponHistory used(Coupon coupon, Instant now) {
        return CouponHistory.builder()
                .id(idGenerator.nextId(HISTORY_PREFIX))
                .action(HistoryAction.USE)
                .couponId(coupon.getId())
                .couponName(coupon.getName())
                .timestamp(now)
                .build();
    }

    /**
     * 만료 이력 (만료 시각 기준)
     * 같은 쿠폰에 대해 항상 같은 ID가 나오도록 쿠폰 ID에서 파생합니다.
     */
    public CouponHistory expired(Coupon coupon) {
        return CouponHistory.builder()
                .id(HISTORY_PREFIX + "_expire_" + coupon.getId())
                .action(HistoryAction.EXPIRE)
                .couponId(coupon.getId())
                .couponName(coupon.getName())
                .timestamp(coupon.getExpiresAt())
                .build();
    }
}
