package com.teambind.loyalty.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teambind.loyalty.adapter.out.crypto.DeviceKeyProvider;
import com.teambind.loyalty.adapter.out.crypto.StoreCipher;
import com.teambind.loyalty.adapter.out.persistence.CouponStorePersistenceAdapter;
import com.teambind.loyalty.adapter.out.persistence.VerificationLockoutPersistenceAdapter;
import com.teambind.loyalty.adapter.out.storage.InMemoryKeyValueStore;
import com.teambind.loyalty.adapter.out.storage.KeyValueStore;
import com.teambind.loyalty.adapter.out.storage.RedisKeyValueStore;
import com.teambind.loyalty.domain.service.CouponStoreRepairer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * 쿠폰 저장 매체 설정
 *
 * coupon.storage.type
 * - redis (기본): 주 저장소와 보안 저장소를 키 접두사로 분리
 * - memory: 프로세스 메모리 (로컬 실행, 테스트)
 */
@Slf4j
@Configuration
public class CouponStorageConfig {

    public static final String PRIMARY_STORAGE = "primaryCouponStorage";
    public static final String SECURE_STORAGE = "secureCouponStorage";

    // 영속 문서는 epoch millis 만 사용하므로 호스트 ObjectMapper 와 분리
    private final ObjectMapper documentMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Configuration
    @ConditionalOnProperty(name = "coupon.storage.type", havingValue = "redis", matchIfMissing = true)
    static class RedisStorage {

        @Bean(name = PRIMARY_STORAGE)
        public KeyValueStore primaryCouponStorage(
                StringRedisTemplate redisTemplate,
                @Value("${coupon.storage.redis.primary-prefix:coupon:primary:}") String prefix) {
            log.info("쿠폰 주 저장소 - Redis, prefix: {}", prefix);
            return new RedisKeyValueStore(redisTemplate, prefix, Integer.MAX_VALUE);
        }

        @Bean(name = SECURE_STORAGE)
        public KeyValueStore secureCouponStorage(
                StringRedisTemplate redisTemplate,
                @Value("${coupon.storage.redis.secure-prefix:coupon:secure:}") String prefix,
                @Value("${coupon.backup.max-bytes:2048}") int maxValueBytes) {
            return new RedisKeyValueStore(redisTemplate, prefix, maxValueBytes);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "coupon.storage.type", havingValue = "memory")
    static class MemoryStorage {

        @Bean(name = PRIMARY_STORAGE)
        public KeyValueStore primaryCouponStorage() {
            log.info("쿠폰 주 저장소 - 메모리");
            return new InMemoryKeyValueStore();
        }

        @Bean(name = SECURE_STORAGE)
        public KeyValueStore secureCouponStorage(@Value("${coupon.backup.max-bytes:2048}") int maxValueBytes) {
            return new InMemoryKeyValueStore(maxValueBytes);
        }
    }

    @Bean
    public DeviceKeyProvider deviceKeyProvider(@Qualifier(SECURE_STORAGE) KeyValueStore secureStore,
                                               CouponEngineProperties properties,
                                               SecureRandom couponSecureRandom,
                                               @Value("${coupon.storage.encryption-key:}") String encryptionKey) {
        return new DeviceKeyProvider(secureStore, properties.getDeviceSeedKey(), () -> couponSecureRandom, encryptionKey);
    }

    @Bean
    public StoreCipher storeCipher(DeviceKeyProvider deviceKeyProvider, SecureRandom couponSecureRandom) {
        return new StoreCipher(deviceKeyProvider, () -> couponSecureRandom);
    }

    @Bean
    public CouponStorePersistenceAdapter couponStorePersistenceAdapter(
            @Qualifier(PRIMARY_STORAGE) KeyValueStore primaryStore,
            @Qualifier(SECURE_STORAGE) KeyValueStore secureStore,
            StoreCipher storeCipher,
            CouponStoreRepairer couponStoreRepairer,
            CouponEngineProperties properties,
            Clock couponClock) {
        return new CouponStorePersistenceAdapter(primaryStore, secureStore, storeCipher, documentMapper,
                couponStoreRepairer, properties, couponClock);
    }

    @Bean
    public VerificationLockoutPersistenceAdapter verificationLockoutPersistenceAdapter(
            @Qualifier(SECURE_STORAGE) KeyValueStore secureStore,
            CouponEngineProperties properties) {
        return new VerificationLockoutPersistenceAdapter(secureStore, documentMapper, properties.getLockoutKey());
    }
}
