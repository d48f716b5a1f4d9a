package com.teambind.loyalty.adapter.out.storage;

import com.teambind.loyalty.domain.exception.CouponDomainException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Redis 기반 저장 매체
 * 매체별 키 접두사로 주 저장소와 보안 저장소를 분리합니다.
 */
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final int maxValueBytes;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate, String keyPrefix, int maxValueBytes) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.maxValueBytes = maxValueBytes;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(redisKey(key)));
        } catch (Exception e) {
            log.error("Redis 조회 오류 - key: {}, error: {}", key, e.getMessage());
            throw new CouponDomainException.StorageUnavailable("저장소 조회에 실패했습니다: " + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        int size = value.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxValueBytes) {
            throw new CouponDomainException.StorageUnavailable(
                    "값 크기가 저장 한도를 초과했습니다: " + size + " > " + maxValueBytes);
        }
        try {
            redisTemplate.opsForValue().set(redisKey(key), value);
            log.debug("Redis 저장 - key: {}, size: {}", key, size);
        } catch (Exception e) {
            log.error("Redis 저장 오류 - key: {}, error: {}", key, e.getMessage());
            throw new CouponDomainException.StorageUnavailable("저장소 기록에 실패했습니다: " + key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            redisTemplate.delete(redisKey(key));
        } catch (Exception e) {
            log.error("Redis 삭제 오류 - key: {}, error: {}", key, e.getMessage());
            throw new CouponDomainException.StorageUnavailable("저장소 삭제에 실패했습니다: " + key, e);
        }
    }

    @Override
    public int maxValueBytes() {
        return maxValueBytes;
    }

    private String redisKey(String key) {
        return keyPrefix + key;
    }
}
