package com.teambind.loyalty.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teambind.loyalty.adapter.out.persistence.document.VerificationLockoutDocument;
import com.teambind.loyalty.adapter.out.storage.KeyValueStore;
import com.teambind.loyalty.application.port.out.LoadVerificationLockoutPort;
import com.teambind.loyalty.application.port.out.SaveVerificationLockoutPort;
import com.teambind.loyalty.domain.exception.CouponDomainException;
import com.teambind.loyalty.domain.model.VerificationLockout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;

/**
 * 코드 검증 잠금 상태 영속성 어댑터
 * 화면 이탈이나 프로세스 재시작으로 시도 횟수가 초기화되지 않도록 별도 키에 저장합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class VerificationLockoutPersistenceAdapter implements LoadVerificationLockoutPort, SaveVerificationLockoutPort {

    private final KeyValueStore secureStore;
    private final ObjectMapper objectMapper;
    private final String lockoutKey;

    @Override
    public VerificationLockout load() {
        try {
            Optional<String> raw = secureStore.get(lockoutKey);
            if (raw.isEmpty() || raw.get().isBlank()) {
                return VerificationLockout.clear();
            }

            VerificationLockoutDocument document = objectMapper.readValue(raw.get(), VerificationLockoutDocument.class);
            Instant lockedUntil = document.getLockoutUntil() > 0
                    ? Instant.ofEpochMilli(document.getLockoutUntil())
                    : null;
            return VerificationLockout.of(Math.max(0, document.getAttempts()), lockedUntil);
        } catch (JsonProcessingException e) {
            log.warn("잠금 레코드 파싱 실패 - 해제 상태로 시작합니다: {}", e.getOriginalMessage());
            return VerificationLockout.clear();
        } catch (CouponDomainException e) {
            log.error("잠금 레코드 조회 실패 - error: {}", e.getMessage());
            return VerificationLockout.clear();
        }
    }

    @Override
    public boolean save(VerificationLockout lockout) {
        VerificationLockoutDocument document = new VerificationLockoutDocument(
                lockout.getFailedAttempts(),
                lockout.hasLock() ? lockout.getLockedUntil().toEpochMilli() : 0L);
        try {
            secureStore.put(lockoutKey, objectMapper.writeValueAsString(document));
            return true;
        } catch (JsonProcessingException e) {
            log.error("잠금 레코드 직렬화 실패", e);
            return false;
        } catch (CouponDomainException e) {
            log.error("잠금 레코드 저장 실패 - error: {}", e.getMessage());
            return false;
        }
    }
}
