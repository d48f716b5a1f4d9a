package com.teambind.loyalty.support;

import com.teambind.loyalty.adapter.out.storage.InMemoryKeyValueStore;
import com.teambind.loyalty.domain.exception.CouponDomainException;

import java.util.Optional;

/**
 * 장애 상태를 켜고 끌 수 있는 메모리 저장 매체
 */
public class SwitchableKeyValueStore extends InMemoryKeyValueStore {

    private volatile boolean unavailable;

    public SwitchableKeyValueStore() {
        super();
    }

    public SwitchableKeyValueStore(int maxValueBytes) {
        super(maxValueBytes);
    }

    public void goDown() {
        unavailable = true;
    }

    public void recover() {
        unavailable = false;
    }

    @Override
    public Optional<String> get(String key) {
        checkAvailable(key);
        return super.get(key);
    }

    @Override
    public void put(String key, String value) {
        checkAvailable(key);
        super.put(key, value);
    }

    private void checkAvailable(String key) {
        if (unavailable) {
            throw new CouponDomainException.StorageUnavailable("저장 매체 연결 실패: " + key);
        }
    }
}
