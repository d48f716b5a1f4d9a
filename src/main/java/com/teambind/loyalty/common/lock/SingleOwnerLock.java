package com.teambind.loyalty.common.lock;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 단일 소유자 비재진입 락
 *
 * 대기하지 않고 즉시 실패하는 tryLock 과, 획득 시 사용한 토큰으로만
 * 해제할 수 있는 unlock 을 제공합니다. 같은 스레드라도 재획득은 실패합니다.
 */
@Slf4j
public class SingleOwnerLock {

    private final String name;
    private final AtomicReference<String> owner = new AtomicReference<>();

    public SingleOwnerLock(String name) {
        this.name = name;
    }

    /**
     * 락 획득 시도
     *
     * @param token 소유자 토큰 (요청마다 고유한 값)
     * @return 획득 성공 여부
     */
    public boolean tryLock(String token) {
        boolean acquired = owner.compareAndSet(null, token);
        if (acquired) {
            log.debug("Lock acquired - name: {}, token: {}", name, token);
        } else {
            log.debug("Failed to acquire lock - name: {}, holder: {}", name, owner.get());
        }
        return acquired;
    }

    /**
     * 락 해제
     *
     * @param token 획득할 때 사용한 토큰
     * @return 해제 성공 여부 (소유자가 아니면 false)
     */
    public boolean unlock(String token) {
        boolean released = owner.compareAndSet(token, null);
        if (released) {
            log.debug("Lock released - name: {}, token: {}", name, token);
        } else {
            log.warn("Failed to release lock - name: {}, token: {} (not owned)", name, token);
        }
        return released;
    }

    public boolean isLocked() {
        return owner.get() != null;
    }
}
