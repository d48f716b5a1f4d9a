package com.teambind.loyalty.common.config;

import com.teambind.loyalty.common.util.SnowflakeIdGenerator;
import com.teambind.loyalty.domain.exception.CouponDomainException;
import com.teambind.loyalty.domain.service.CouponHistoryRecorder;
import com.teambind.loyalty.domain.service.CouponStoreRepairer;
import com.teambind.loyalty.domain.service.SecretCodeGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

/**
 * 쿠폰 엔진 설정
 *
 * 호스트 애플리케이션은 PointLedgerPort 빈을 제공하고 이 설정을 import 합니다.
 */
@Configuration
@ComponentScan("com.teambind.loyalty.application.service")
@Import(CouponStorageConfig.class)
public class CouponEngineConfig {

    @Bean
    public Clock couponClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CouponEngineProperties couponEngineProperties(
            @Value("${coupon.exchange.cost:50000}") long costPerCoupon,
            @Value("${coupon.exchange.cooldown-seconds:5}") long cooldownSeconds,
            @Value("${coupon.exchange.max-live-coupons:100}") int maxLiveCoupons,
            @Value("${coupon.exchange.code-collision-retries:5}") int codeCollisionRetries,
            @Value("${coupon.validity-days:90}") long validityDays,
            @Value("${coupon.store.max-coupons:200}") int maxStoredCoupons,
            @Value("${coupon.store.max-history:200}") int maxHistory,
            @Value("${coupon.store.corruption-multiplier:5}") int corruptionMultiplier,
            @Value("${coupon.verification.max-attempts:3}") int maxVerificationAttempts,
            @Value("${coupon.verification.lockout-seconds:300}") long lockoutSeconds,
            @Value("${coupon.verification.min-code-length:12}") int minCodeLength,
            @Value("${coupon.backup.max-bytes:2048}") int backupMaxBytes,
            @Value("${coupon.backup.max-coupons:10}") int backupMaxCoupons) {

        CouponEngineProperties properties = CouponEngineProperties.builder()
                .costPerCoupon(costPerCoupon)
                .exchangeCooldown(Duration.ofSeconds(cooldownSeconds))
                .maxLiveCoupons(maxLiveCoupons)
                .codeCollisionRetries(codeCollisionRetries)
                .couponValidity(Duration.ofDays(validityDays))
                .maxStoredCoupons(maxStoredCoupons)
                .maxHistory(maxHistory)
                .corruptionMultiplier(corruptionMultiplier)
                .maxVerificationAttempts(maxVerificationAttempts)
                .lockoutDuration(Duration.ofSeconds(lockoutSeconds))
                .minCodeLength(minCodeLength)
                .backupMaxBytes(backupMaxBytes)
                .backupMaxCoupons(backupMaxCoupons)
                .build();
        properties.storeLimits(); // 제한 값 검증
        return properties;
    }

    @Bean
    public SnowflakeIdGenerator couponIdGenerator(@Value("${coupon.id.node-id:1}") long nodeId, Clock couponClock) {
        return new SnowflakeIdGenerator(nodeId, couponClock);
    }

    /**
     * JDK DRBG 보안 난수
     */
    @Bean
    public SecureRandom couponSecureRandom() {
        try {
            return SecureRandom.getInstance("DRBG");
        } catch (NoSuchAlgorithmException e) {
            throw new CouponDomainException.EntropyUnavailable("DRBG 보안 난수를 사용할 수 없습니다", e);
        }
    }

    @Bean
    public SecretCodeGenerator secretCodeGenerator(SecureRandom couponSecureRandom) {
        return new SecretCodeGenerator(() -> couponSecureRandom);
    }

    @Bean
    public CouponHistoryRecorder couponHistoryRecorder(SnowflakeIdGenerator couponIdGenerator) {
        return new CouponHistoryRecorder(couponIdGenerator);
    }

    @Bean
    public CouponStoreRepairer couponStoreRepairer(SecretCodeGenerator secretCodeGenerator,
                                                   CouponHistoryRecorder couponHistoryRecorder) {
        return new CouponStoreRepairer(secretCodeGenerator, couponHistoryRecorder);
    }
}
