package com.teambind.loyalty.common.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SingleOwnerLock 테스트")
class SingleOwnerLockTest {

    @Test
    @DisplayName("획득 후 같은 토큰으로만 해제할 수 있다")
    void releaseOnlyByOwner() {
        // given
        SingleOwnerLock lock = new SingleOwnerLock("test");

        // when
        boolean acquired = lock.tryLock("owner");

        // then
        assertThat(acquired).isTrue();
        assertThat(lock.unlock("intruder")).isFalse();
        assertThat(lock.isLocked()).isTrue();
        assertThat(lock.unlock("owner")).isTrue();
        assertThat(lock.isLocked()).isFalse();
    }

    @Test
    @DisplayName("재진입할 수 없다")
    void notReentrant() {
        SingleOwnerLock lock = new SingleOwnerLock("test");

        assertThat(lock.tryLock("a")).isTrue();
        assertThat(lock.tryLock("a")).isFalse();
        assertThat(lock.tryLock("b")).isFalse();
    }

    @Test
    @DisplayName("동시에 시도하면 하나만 획득한다")
    void onlyOneWinner() throws InterruptedException {
        // given
        SingleOwnerLock lock = new SingleOwnerLock("test");
        int threadCount = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger winners = new AtomicInteger();

        // when
        for (int i = 0; i < threadCount; i++) {
            String token = "t" + i;
            executor.submit(() -> {
                try {
                    start.await();
                    if (lock.tryLock(token)) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // then
        assertThat(winners.get()).isEqualTo(1);
    }
}
