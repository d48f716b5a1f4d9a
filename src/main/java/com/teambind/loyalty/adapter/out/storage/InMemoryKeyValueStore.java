package com.teambind.loyalty.adapter.out.storage;

import com.teambind.loyalty.domain.exception.CouponDomainException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 메모리 기반 저장 매체
 * 로컬 실행과 테스트용. 값 크기 상한을 두면 키체인형 보안 저장소처럼 동작합니다.
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final int maxValueBytes;

    public InMemoryKeyValueStore() {
        this(Integer.MAX_VALUE);
    }

    public InMemoryKeyValueStore(int maxValueBytes) {
        this.maxValueBytes = maxValueBytes;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(String key, String value) {
        int size = value.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxValueBytes) {
            log.warn("저장 크기 초과 - key: {}, size: {}, max: {}", key, size, maxValueBytes);
            throw new CouponDomainException.StorageUnavailable(
                    "값 크기가 저장 한도를 초과했습니다: " + size + " > " + maxValueBytes);
        }
        values.put(key, value);
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }

    @Override
    public int maxValueBytes() {
        return maxValueBytes;
    }
}
