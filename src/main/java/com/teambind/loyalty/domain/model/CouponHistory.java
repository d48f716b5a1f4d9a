package com.teambind.loyalty.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 쿠폰 이력 항목 (추가 전용)
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class CouponHistory {

    private final String id;
    private final HistoryAction action;
    private final String couponId;
    private final String couponName;
    private final Long pointsSpent;
    private final Instant timestamp;
}
