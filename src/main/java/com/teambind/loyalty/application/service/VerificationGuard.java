package com.teambind.loyalty.application.service;

import com.teambind.loyalty.application.port.out.LoadVerificationLockoutPort;
import com.teambind.loyalty.application.port.out.SaveVerificationLockoutPort;
import com.teambind.loyalty.common.config.CouponEngineProperties;
import com.teambind.loyalty.domain.model.VerificationLockout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 비밀 코드 검증 잠금 관리
 *
 * 연속 실패가 maxAttempts 에 도달하면 lockoutDuration 동안 검증을 거부합니다.
 * 모든 상태 전이는 즉시 저장되어 프로세스가 종료되어도 잠금이 유지됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationGuard {

    private final LoadVerificationLockoutPort loadLockoutPort;
    private final SaveVerificationLockoutPort saveLockoutPort;
    private final CouponEngineProperties properties;
    private final Clock clock;

    private VerificationLockout state;

    /**
     * 검증 가능 여부 확인
     * 잠금 시간이 지났으면 이 호출에서 해제(카운터 초기화)한 뒤 판단합니다.
     */
    public synchronized AccessCheck checkAccess() {
        Instant now = clock.instant();
        VerificationLockout current = state();
        VerificationLockout released = current.releaseIfElapsed(now);

        if (!released.equals(current)) {
            log.info("코드 검증 잠금 해제");
            transition(released);
        }

        if (released.isLockedAt(now)) {
            return new AccessCheck(true, released.remainingLockAt(now), 0);
        }
        return new AccessCheck(false, Duration.ZERO, released.remainingAttempts(properties.getMaxVerificationAttempts()));
    }

    /**
     * 일치하는 코드 없음 - 실패 1회 기록
     */
    public synchronized FailureOutcome recordFailure() {
        Instant now = clock.instant();
        VerificationLockout next = state().releaseIfElapsed(now)
                .registerFailure(now, properties.getMaxVerificationAttempts(), properties.getLockoutDuration());
        transition(next);

        if (next.isLockedAt(now)) {
            log.warn("코드 검증 잠금 - lockedUntil: {}", next.getLockedUntil());
            return new FailureOutcome(true, 0, next.remainingLockAt(now));
        }

        int remaining = next.remainingAttempts(properties.getMaxVerificationAttempts());
        log.warn("코드 검증 실패 - attempts: {}, remaining: {}", next.getFailedAttempts(), remaining);
        return new FailureOutcome(false, remaining, Duration.ZERO);
    }

    /**
     * 유효한 코드로 검증 성공 - 카운터 초기화
     */
    public synchronized void recordSuccess() {
        if (!state().equals(VerificationLockout.clear())) {
            transition(VerificationLockout.clear());
        }
    }

    public synchronized VerificationLockout currentState() {
        return state();
    }

    private VerificationLockout state() {
        if (state == null) {
            state = loadLockoutPort.load();
        }
        return state;
    }

    private void transition(VerificationLockout next) {
        state = next;
        if (!saveLockoutPort.save(next)) {
            log.error("코드 검증 잠금 상태 저장 실패 - 현재 프로세스에서만 유지됩니다");
        }
    }

    /**
     * @param locked            잠금 여부
     * @param remainingLockout  남은 잠금 시간
     * @param remainingAttempts 남은 시도 횟수
     */
    public record AccessCheck(boolean locked, Duration remainingLockout, int remainingAttempts) {
    }

    /**
     * @param lockedOut         이번 실패로 잠금 전이했는지
     * @param remainingAttempts 남은 시도 횟수
     * @param remainingLockout  남은 잠금 시간
     */
    public record FailureOutcome(boolean lockedOut, int remainingAttempts, Duration remainingLockout) {
    }
}
