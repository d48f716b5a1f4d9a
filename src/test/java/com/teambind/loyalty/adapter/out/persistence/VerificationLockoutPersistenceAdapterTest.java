package com.teambind.loyalty.adapter.out.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teambind.loyalty.adapter.out.storage.InMemoryKeyValueStore;
import com.teambind.loyalty.adapter.out.storage.KeyValueStore;
import com.teambind.loyalty.domain.exception.CouponDomainException;
import com.teambind.loyalty.domain.model.VerificationLockout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;

@ExtendWith(MockitoExtension.class)
@DisplayName("VerificationLockoutPersistenceAdapter 테스트")
class VerificationLockoutPersistenceAdapterTest {

    private static final String KEY = "coupon_verify_lockout_v1";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private KeyValueStore failingStore;

    private InMemoryKeyValueStore secureStore;
    private VerificationLockoutPersistenceAdapter adapter;

    @BeforeEach
    void setUp() {
        secureStore = new InMemoryKeyValueStore(2048);
        adapter = new VerificationLockoutPersistenceAdapter(secureStore, objectMapper, KEY);
    }

    @Test
    @DisplayName("저장된 레코드가 없으면 해제 상태")
    void clearWhenMissing() {
        assertThat(adapter.load()).isEqualTo(VerificationLockout.clear());
    }

    @Test
    @DisplayName("잠금 상태를 {attempts, lockoutUntil} 형식으로 저장하고 복원한다")
    void roundTrip() {
        // given
        Instant lockedUntil = Instant.parse("2025-03-01T00:05:00Z");
        VerificationLockout locked = VerificationLockout.of(0, lockedUntil);

        // when
        boolean saved = adapter.save(locked);

        // then
        assertThat(saved).isTrue();
        assertThat(secureStore.get(KEY)).contains(
                "{\"attempts\":0,\"lockoutUntil\":" + lockedUntil.toEpochMilli() + "}");
        assertThat(adapter.load()).isEqualTo(locked);
    }

    @Test
    @DisplayName("잠금 없는 실패 횟수도 복원한다")
    void attemptsOnly() {
        adapter.save(VerificationLockout.of(2, null));

        assertThat(adapter.load()).isEqualTo(VerificationLockout.of(2, null));
    }

    @Test
    @DisplayName("손상된 레코드는 해제 상태로 읽는다")
    void corruptedRecord() {
        secureStore.put(KEY, "{not-json");

        assertThat(adapter.load()).isEqualTo(VerificationLockout.clear());
    }

    @Test
    @DisplayName("저장 매체 오류는 false 를 반환하고 조회는 해제 상태")
    void storageFailure() {
        // given
        VerificationLockoutPersistenceAdapter failing =
                new VerificationLockoutPersistenceAdapter(failingStore, objectMapper, KEY);
        willThrow(new CouponDomainException.StorageUnavailable("down"))
                .given(failingStore).put(anyString(), anyString());
        given(failingStore.get(KEY)).willThrow(new CouponDomainException.StorageUnavailable("down"));

        // when & then
        assertThat(failing.save(VerificationLockout.of(1, null))).isFalse();
        assertThat(failing.load()).isEqualTo(VerificationLockout.clear());
    }
}
