package com.teambind.loyalty.common.config;

import com.teambind.loyalty.application.port.in.CouponOperationResult;
import com.teambind.loyalty.application.port.in.ExchangeCouponCommand;
import com.teambind.loyalty.application.port.in.GetCouponsQuery;
import com.teambind.loyalty.application.port.in.VerifyCouponCodeCommand;
import com.teambind.loyalty.application.port.out.PointLedgerPort;
import com.teambind.loyalty.application.service.CouponLifecycleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 메모리 저장 매체로 전체 빈 구성 확인
 */
@SpringBootTest(
        classes = {CouponEngineConfig.class, CouponEngineConfigTest.LedgerConfig.class},
        properties = {
                "coupon.storage.type=memory",
                "coupon.exchange.cooldown-seconds=1",
                "coupon.verification.lockout-seconds=60"
        })
@DisplayName("CouponEngineConfig 테스트")
class CouponEngineConfigTest {

    @Autowired
    private CouponLifecycleService lifecycleService;

    @Autowired
    private GetCouponsQuery couponsQuery;

    @Autowired
    private CouponEngineProperties properties;

    @Autowired
    private AtomicLong pointBalance;

    @Test
    @DisplayName("설정 값을 정책에 반영한다")
    void bindsProperties() {
        assertThat(properties.getExchangeCooldown()).isEqualTo(Duration.ofSeconds(1));
        assertThat(properties.getLockoutDuration()).isEqualTo(Duration.ofSeconds(60));
        assertThat(properties.getCostPerCoupon()).isEqualTo(50_000L);
        assertThat(properties.getBackupMaxBytes()).isEqualTo(2048);
    }

    @Test
    @DisplayName("교환한 쿠폰을 코드로 인증할 수 있다")
    void exchangeAndVerify() {
        // given
        lifecycleService.initialize();

        // when
        CouponOperationResult exchanged = lifecycleService.exchange(ExchangeCouponCommand.of(pointBalance.get()));
        CouponOperationResult verified = lifecycleService.verifyByCode(
                VerifyCouponCodeCommand.of(exchanged.getCoupon().getSecretCode().formatted()));

        // then
        assertThat(exchanged.isSuccess()).isTrue();
        assertThat(verified.isSuccess()).isTrue();
        assertThat(pointBalance.get()).isEqualTo(50_000L);
        assertThat(couponsQuery.getHistory()).hasSize(2);
    }

    @TestConfiguration
    static class LedgerConfig {

        @Bean
        AtomicLong pointBalance() {
            return new AtomicLong(100_000L);
        }

        @Bean
        PointLedgerPort pointLedgerPort(AtomicLong pointBalance) {
            return new PointLedgerPort() {
                @Override
                public boolean spendPoints(long amount, String reason) {
                    return pointBalance.getAndUpdate(b -> b >= amount ? b - amount : b) >= amount;
                }

                @Override
                public boolean addPoints(long amount, String reason) {
                    pointBalance.addAndGet(amount);
                    return true;
                }
            };
        }
    }
}
