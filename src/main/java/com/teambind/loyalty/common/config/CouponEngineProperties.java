package com.teambind.loyalty.common.config;

import com.teambind.loyalty.domain.model.CouponStoreLimits;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 쿠폰 엔진 정책 값
 * 기본값은 application.yml 과 동일합니다.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class CouponEngineProperties {

    // 교환
    @Builder.Default
    private final long costPerCoupon = 50_000L;
    @Builder.Default
    private final Duration exchangeCooldown = Duration.ofSeconds(5);
    @Builder.Default
    private final int maxLiveCoupons = 100;
    @Builder.Default
    private final Duration couponValidity = Duration.ofDays(90);
    @Builder.Default
    private final int codeCollisionRetries = 5;

    // 저장소
    @Builder.Default
    private final int maxStoredCoupons = 200;
    @Builder.Default
    private final int maxHistory = 200;
    @Builder.Default
    private final int corruptionMultiplier = 5;

    // 코드 검증
    @Builder.Default
    private final int maxVerificationAttempts = 3;
    @Builder.Default
    private final Duration lockoutDuration = Duration.ofMinutes(5);
    @Builder.Default
    private final int minCodeLength = 12;

    // 백업
    @Builder.Default
    private final int backupMaxBytes = 2048;
    @Builder.Default
    private final int backupMaxCoupons = 10;

    // 저장 키
    @Builder.Default
    private final String primaryKey = "@coupons_data";
    @Builder.Default
    private final String backupKey = "coupons_backup_v1";
    @Builder.Default
    private final String lockoutKey = "coupon_verify_lockout_v1";
    @Builder.Default
    private final String deviceSeedKey = "sp_enc_seed_v1";

    public static CouponEngineProperties defaults() {
        return CouponEngineProperties.builder().build();
    }

    public CouponStoreLimits storeLimits() {
        return new CouponStoreLimits(maxStoredCoupons, maxHistory, corruptionMultiplier);
    }
}
