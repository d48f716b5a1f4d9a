package com.teambind.loyalty.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 비밀 코드 검증 잠금 상태
 *
 * unlocked: failedAttempts 0..maxAttempts-1, lockedUntil 없음
 * locked:   lockedUntil 까지 모든 검증 요청 거부, failedAttempts 는 0
 */
@Getter
@EqualsAndHashCode
@ToString
public class VerificationLockout {

    private static final VerificationLockout CLEAR = new VerificationLockout(0, null);

    private final int failedAttempts;
    private final Instant lockedUntil;

    private VerificationLockout(int failedAttempts, Instant lockedUntil) {
        this.failedAttempts = failedAttempts;
        this.lockedUntil = lockedUntil;
    }

    public static VerificationLockout clear() {
        return CLEAR;
    }

    public static VerificationLockout of(int failedAttempts, Instant lockedUntil) {
        if (failedAttempts < 0) {
            throw new IllegalArgumentException("실패 횟수는 음수일 수 없습니다");
        }
        return new VerificationLockout(failedAttempts, lockedUntil);
    }

    public boolean hasLock() {
        return lockedUntil != null;
    }

    /**
     * now 시점에 잠금이 유효한지 여부 (lockedUntil 과 같은 시각이면 해제)
     */
    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && now.isBefore(lockedUntil);
    }

    public Duration remainingLockAt(Instant now) {
        if (!isLockedAt(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, lockedUntil);
    }

    /**
     * 잠금 시간이 지났으면 카운터를 초기화한 해제 상태를 반환
     */
    public VerificationLockout releaseIfElapsed(Instant now) {
        if (lockedUntil != null && !now.isBefore(lockedUntil)) {
            return CLEAR;
        }
        return this;
    }

    /**
     * 실패 1회 기록
     * maxAttempts 에 도달하면 잠금으로 전이하고 카운터는 0으로 초기화
     */
    public VerificationLockout registerFailure(Instant now, int maxAttempts, Duration lockoutDuration) {
        if (isLockedAt(now)) {
            throw new IllegalStateException("잠금 상태에서는 실패를 기록할 수 없습니다");
        }
        int attempts = failedAttempts + 1;
        if (attempts >= maxAttempts) {
            return new VerificationLockout(0, now.plus(lockoutDuration));
        }
        return new VerificationLockout(attempts, null);
    }

    public int remainingAttempts(int maxAttempts) {
        return Math.max(0, maxAttempts - failedAttempts);
    }
}
