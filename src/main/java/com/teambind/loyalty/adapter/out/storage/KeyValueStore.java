package com.teambind.loyalty.adapter.out.storage;

import java.util.Optional;

/**
 * 문자열 키-값 저장 매체
 *
 * 구현체는 접근 실패 시 CouponDomainException.StorageUnavailable 을 던집니다.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);

    /**
     * 값 하나의 최대 크기 (UTF-8 바이트), 제한이 없으면 Integer.MAX_VALUE
     */
    default int maxValueBytes() {
        return Integer.MAX_VALUE;
    }
}
