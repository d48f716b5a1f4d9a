package com.teambind.loyalty.application.service;

import com.teambind.loyalty.application.port.in.CouponOperationResult;
import com.teambind.loyalty.application.port.in.ExchangeCouponCommand;
import com.teambind.loyalty.application.port.in.ExchangeCouponUseCase;
import com.teambind.loyalty.application.port.in.UseCouponCommand;
import com.teambind.loyalty.application.port.in.UseCouponUseCase;
import com.teambind.loyalty.application.port.in.VerifyCouponCodeCommand;
import com.teambind.loyalty.application.port.in.VerifyCouponCodeUseCase;
import com.teambind.loyalty.application.port.out.PointLedgerPort;
import com.teambind.loyalty.application.port.out.SaveCouponStorePort;
import com.teambind.loyalty.common.config.CouponEngineProperties;
import com.teambind.loyalty.common.lock.SingleOwnerLock;
import com.teambind.loyalty.common.util.SnowflakeIdGenerator;
import com.teambind.loyalty.domain.exception.CouponDomainException;
import com.teambind.loyalty.domain.exception.CouponErrorCode;
import com.teambind.loyalty.domain.model.Coupon;
import com.teambind.loyalty.domain.model.CouponHistory;
import com.teambind.loyalty.domain.model.CouponStore;
import com.teambind.loyalty.domain.model.SecretCode;
import com.teambind.loyalty.domain.service.CouponHistoryRecorder;
import com.teambind.loyalty.domain.service.SecretCodeGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * 쿠폰 수명주기 서비스
 *
 * 교환, 직접 사용, 코드 검증 사용을 하나의 비재진입 락으로 직렬화합니다.
 * 진행 중인 연산이 있으면 대기하지 않고 BUSY 로 거부하며, 락은 finally 에서 항상 해제됩니다.
 *
 * 상태 변경은 읽기-계산-저장-공개 순서로 처리합니다. 저장에 실패한 상태는 공개되지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CouponLifecycleService implements ExchangeCouponUseCase, UseCouponUseCase, VerifyCouponCodeUseCase {

    static final String SPEND_REASON = "쿠폰 교환";
    static final String REFUND_REASON = "쿠폰 교환 실패 환불";

    private static final String COUPON_PREFIX = "coupon";

    private final CouponStoreState storeState;
    private final SaveCouponStorePort saveCouponStorePort;
    private final PointLedgerPort pointLedgerPort;
    private final VerificationGuard verificationGuard;
    private final SecretCodeGenerator secretCodeGenerator;
    private final CouponHistoryRecorder historyRecorder;
    private final SnowflakeIdGenerator idGenerator;
    private final CouponEngineProperties properties;
    private final Clock clock;

    private final SingleOwnerLock operationLock = new SingleOwnerLock("coupon-operation");

    // 잔액과 한도 검증을 통과한 마지막 교환 시각 (이후 성공/실패 무관), 락 안에서만 갱신
    private volatile Instant lastExchangeStartedAt;

    // ==================== 교환 ====================

    @Override
    public CouponOperationResult exchange(ExchangeCouponCommand command) {
        String token = newToken();
        if (!operationLock.tryLock(token)) {
            log.debug("쿠폰 교환 거부 - 다른 연산 진행 중");
            return CouponOperationResult.failure(CouponErrorCode.BUSY);
        }

        try {
            return doExchange(command);
        } catch (CouponDomainException e) {
            log.error("쿠폰 교환 실패 - errorCode: {}, error: {}", e.getErrorCode(), e.getMessage(), e);
            return CouponOperationResult.failure(e.getErrorCode());
        } catch (RuntimeException e) {
            log.error("쿠폰 교환 중 예상하지 못한 오류", e);
            return CouponOperationResult.failure(CouponErrorCode.UNEXPECTED_ERROR);
        } finally {
            operationLock.unlock(token);
        }
    }

    private CouponOperationResult doExchange(ExchangeCouponCommand command) {
        Instant now = clock.instant();
        long cost = properties.getCostPerCoupon();

        // 1. 포인트 검증
        if (command.getPointBalance() < cost) {
            return CouponOperationResult.failure(CouponErrorCode.INSUFFICIENT_BALANCE,
                    String.format("포인트가 부족합니다. (필요: %,dP, 보유: %,dP)", cost, command.getPointBalance()));
        }

        // 2. 보유 한도 검증
        CouponStore store = storeState.current();
        if (store.countAvailable(now) >= properties.getMaxLiveCoupons()) {
            return CouponOperationResult.failure(CouponErrorCode.CAPACITY_EXCEEDED,
                    String.format("최대 %d개의 쿠폰만 보유할 수 있습니다.", properties.getMaxLiveCoupons()));
        }

        // 3. 연속 탭 방지 - 차감까지 진행할 수 있는 교환만 쿨다운을 시작
        Instant lastStarted = lastExchangeStartedAt;
        if (lastStarted != null && now.isBefore(lastStarted.plus(properties.getExchangeCooldown()))) {
            Duration wait = Duration.between(now, lastStarted.plus(properties.getExchangeCooldown()));
            return CouponOperationResult.failure(CouponErrorCode.COOLDOWN,
                    String.format("잠시 후 다시 시도해주세요. (%d초 후 가능)", ceilSeconds(wait)));
        }
        lastExchangeStartedAt = now;

        // 4. 포인트 차감 전에 쿠폰과 이력 준비
        Coupon coupon = Coupon.issue(
                idGenerator.nextId(COUPON_PREFIX),
                command.getKind(),
                uniqueSecretCode(store),
                now,
                properties.getCouponValidity());
        CouponHistory entry = historyRecorder.exchanged(coupon, cost, now);
        CouponStore updated = store.withExchangedCoupon(coupon, entry, properties.storeLimits());

        // 5. 포인트 차감 - 실패하면 아무것도 변경하지 않음
        if (!spendSafely(cost)) {
            log.warn("쿠폰 교환 중단 - 포인트 차감 실패");
            return CouponOperationResult.failure(CouponErrorCode.LEDGER_FAILURE);
        }

        // 6. 저장 - 실패하면 보상 환불
        if (!saveSafely(updated)) {
            return compensateExchange(cost);
        }

        storeState.publish(updated);
        log.info("쿠폰 교환 완료 - couponId: {}, kind: {}, code: {}, totalExchanged: {}",
                coupon.getId(), coupon.getKind(), coupon.getSecretCode().masked(), updated.getTotalExchanged());

        return CouponOperationResult.success(coupon, coupon.getName() + "을(를) 획득했습니다!");
    }

    private CouponOperationResult compensateExchange(long cost) {
        boolean refunded;
        try {
            refunded = pointLedgerPort.addPoints(cost, REFUND_REASON);
        } catch (RuntimeException e) {
            log.error("보상 환불 중 오류", e);
            refunded = false;
        }

        if (refunded) {
            log.warn("쿠폰 저장 실패 - 포인트 환불 완료 - amount: {}", cost);
            return CouponOperationResult.builder()
                    .success(false)
                    .errorCode(CouponErrorCode.PERSISTENCE_FAILURE)
                    .message(String.format("쿠폰 저장에 실패하여 %,dP를 환불했습니다. 다시 시도해주세요.", cost))
                    .refunded(true)
                    .build();
        }

        log.error("쿠폰 저장 실패 및 환불 실패 - 포인트 차감 상태 - amount: {}", cost);
        return CouponOperationResult.builder()
                .success(false)
                .errorCode(CouponErrorCode.PERSISTENCE_FAILURE)
                .message(String.format("쿠폰 저장에 실패했습니다. %,dP가 차감되었으니 고객센터에 문의해주세요.", cost))
                .refunded(false)
                .build();
    }

    /**
     * 보관 중인 코드와 겹치지 않는 비밀 코드 생성
     */
    private SecretCode uniqueSecretCode(CouponStore store) {
        for (int attempt = 0; attempt < properties.getCodeCollisionRetries(); attempt++) {
            SecretCode candidate = secretCodeGenerator.generate();
            boolean collides = store.getCoupons().stream()
                    .anyMatch(coupon -> candidate.equals(coupon.getSecretCode()));
            if (!collides) {
                return candidate;
            }
            log.warn("비밀 코드 충돌 - 재생성 attempt: {}", attempt + 1);
        }
        throw new IllegalStateException("비밀 코드 충돌이 반복되어 발급을 중단합니다");
    }

    // ==================== 직접 사용 ====================

    @Override
    public CouponOperationResult useDirectly(UseCouponCommand command) {
        String token = newToken();
        if (!operationLock.tryLock(token)) {
            return CouponOperationResult.failure(CouponErrorCode.BUSY);
        }

        try {
            Instant now = clock.instant();
            CouponStore store = storeState.current();

            Optional<Coupon> found = store.findById(command.getCouponId());
            if (found.isEmpty()) {
                return CouponOperationResult.failure(CouponErrorCode.NOT_FOUND);
            }

            Coupon coupon = found.get();
            Optional<CouponOperationResult> unusable = rejectUnusable(coupon, now);
            if (unusable.isPresent()) {
                return unusable.get();
            }

            Coupon used = coupon.markUsed(now);
            CouponStore updated = store.withUsedCoupon(used, historyRecorder.used(used, now), properties.storeLimits());
            if (!saveSafely(updated)) {
                return CouponOperationResult.failure(CouponErrorCode.PERSISTENCE_FAILURE,
                        "쿠폰 사용 정보를 저장하지 못했습니다. 다시 시도해주세요.");
            }

            storeState.publish(updated);
            log.info("쿠폰 직접 사용 완료 - couponId: {}", used.getId());
            return CouponOperationResult.success(used, used.getName() + "이(가) 사용되었습니다!");
        } catch (CouponDomainException e) {
            log.error("쿠폰 사용 실패 - couponId: {}, errorCode: {}", command.getCouponId(), e.getErrorCode(), e);
            return CouponOperationResult.failure(e.getErrorCode());
        } catch (RuntimeException e) {
            log.error("쿠폰 사용 중 오류 - couponId: {}", command.getCouponId(), e);
            return CouponOperationResult.failure(CouponErrorCode.UNEXPECTED_ERROR);
        } finally {
            operationLock.unlock(token);
        }
    }

    // ==================== 코드 검증 사용 ====================

    @Override
    public CouponOperationResult verifyByCode(VerifyCouponCodeCommand command) {
        String token = newToken();
        if (!operationLock.tryLock(token)) {
            return CouponOperationResult.failure(CouponErrorCode.BUSY);
        }

        try {
            return doVerify(command);
        } catch (CouponDomainException e) {
            log.error("쿠폰 코드 검증 실패 - errorCode: {}", e.getErrorCode(), e);
            return CouponOperationResult.failure(e.getErrorCode());
        } catch (RuntimeException e) {
            log.error("쿠폰 코드 검증 중 오류", e);
            return CouponOperationResult.failure(CouponErrorCode.UNEXPECTED_ERROR);
        } finally {
            operationLock.unlock(token);
        }
    }

    private CouponOperationResult doVerify(VerifyCouponCodeCommand command) {
        // 1. 잠금 확인 (시도 횟수 차감 없음)
        VerificationGuard.AccessCheck access = verificationGuard.checkAccess();
        if (access.locked()) {
            return lockedOut(access.remainingLockout());
        }

        // 2. 입력 정규화 - 너무 짧으면 시도 횟수 차감 없이 거부
        String normalized = SecretCode.normalize(command.getRawCode());
        if (normalized.length() < properties.getMinCodeLength()) {
            return CouponOperationResult.failure(CouponErrorCode.INVALID_INPUT,
                    String.format("쿠폰 코드 %d자리를 모두 입력해주세요.", SecretCode.LENGTH));
        }

        // 3. 상수 시간 탐색
        Instant now = clock.instant();
        CouponStore store = storeState.current();
        Coupon matched = findByCodeConstantTime(store, normalized);

        // 4. 불일치 - 실패 기록
        if (matched == null) {
            VerificationGuard.FailureOutcome failure = verificationGuard.recordFailure();
            if (failure.lockedOut()) {
                return lockedOut(failure.remainingLockout());
            }
            return CouponOperationResult.builder()
                    .success(false)
                    .errorCode(CouponErrorCode.NOT_FOUND)
                    .message(String.format("유효하지 않은 쿠폰 코드입니다. (남은 시도: %d회)", failure.remainingAttempts()))
                    .remainingAttempts(failure.remainingAttempts())
                    .build();
        }

        // 5. 사용/만료 쿠폰은 신원 증명이 아니므로 카운터를 초기화하지 않음
        Optional<CouponOperationResult> unusable = rejectUnusable(matched, now);
        if (unusable.isPresent()) {
            log.warn("사용 불가 쿠폰 코드 제출 - couponId: {}, code: {}", matched.getId(), matched.getSecretCode().masked());
            return unusable.get();
        }

        // 6. 유효 - 카운터 초기화 후 사용 처리
        verificationGuard.recordSuccess();

        Coupon verified = matched.markVerified(now);
        CouponStore updated = store.withUsedCoupon(verified, historyRecorder.used(verified, now), properties.storeLimits());
        if (!saveSafely(updated)) {
            return CouponOperationResult.failure(CouponErrorCode.PERSISTENCE_FAILURE,
                    "쿠폰 인증 정보를 저장하지 못했습니다. 다시 시도해주세요.");
        }

        storeState.publish(updated);
        log.info("쿠폰 코드 인증 완료 - couponId: {}, code: {}", verified.getId(), verified.getSecretCode().masked());
        return CouponOperationResult.success(verified, verified.getName() + " 인증이 완료되었습니다!");
    }

    /**
     * 모든 쿠폰과 비교하며 중간에 멈추지 않음
     */
    private Coupon findByCodeConstantTime(CouponStore store, String normalized) {
        Coupon matched = null;
        for (Coupon coupon : store.getCoupons()) {
            if (!coupon.hasSecretCode()) {
                continue;
            }
            boolean equal = coupon.getSecretCode().matches(normalized);
            if (equal && matched == null) {
                matched = coupon;
            }
        }
        return matched;
    }

    // ==================== 수명주기 ====================

    /**
     * 콜드 스타트 적재
     * 진행 중인 연산이 있거나 저장소를 읽을 수 없으면 false 를 반환하고, 다음 접근에서 다시 적재합니다.
     */
    public boolean initialize() {
        String token = newToken();
        if (!operationLock.tryLock(token)) {
            log.debug("쿠폰 저장소 적재 생략 - 연산 진행 중");
            return false;
        }
        try {
            storeState.reload();
            return true;
        } catch (CouponDomainException e) {
            log.error("쿠폰 저장소 적재 실패 - errorCode: {}, error: {}", e.getErrorCode(), e.getMessage());
            return false;
        } finally {
            operationLock.unlock(token);
        }
    }

    /**
     * 백그라운드 전환 시 현재 상태 저장 (최선 노력)
     * 진행 중인 연산이 있으면 그 연산이 저장하므로 건너뜁니다.
     */
    public boolean flush() {
        String token = newToken();
        if (!operationLock.tryLock(token)) {
            log.debug("백그라운드 저장 생략 - 연산 진행 중");
            return false;
        }
        try {
            return saveSafely(storeState.current());
        } catch (CouponDomainException e) {
            log.error("백그라운드 저장 실패 - 저장소 적재 불가 - error: {}", e.getMessage());
            return false;
        } finally {
            operationLock.unlock(token);
        }
    }

    // ==================== 내부 ====================

    private Optional<CouponOperationResult> rejectUnusable(Coupon coupon, Instant now) {
        if (coupon.isUsed()) {
            return Optional.of(CouponOperationResult.failure(CouponErrorCode.ALREADY_USED));
        }
        if (coupon.isExpiredAt(now)) {
            return Optional.of(CouponOperationResult.failure(CouponErrorCode.EXPIRED));
        }
        return Optional.empty();
    }

    private CouponOperationResult lockedOut(Duration remaining) {
        long seconds = ceilSeconds(remaining);
        return CouponOperationResult.builder()
                .success(false)
                .errorCode(CouponErrorCode.LOCKED_OUT)
                .message(String.format("인증 시도 횟수를 초과했습니다. %d분 %d초 후 다시 시도해주세요.",
                        seconds / 60, seconds % 60))
                .remainingLockout(remaining)
                .remainingAttempts(0)
                .build();
    }

    private boolean spendSafely(long amount) {
        try {
            return pointLedgerPort.spendPoints(amount, SPEND_REASON);
        } catch (RuntimeException e) {
            log.error("포인트 차감 중 오류 - amount: {}", amount, e);
            return false;
        }
    }

    private boolean saveSafely(CouponStore store) {
        try {
            return saveCouponStorePort.save(store);
        } catch (RuntimeException e) {
            log.error("쿠폰 저장소 저장 중 오류", e);
            return false;
        }
    }

    private static long ceilSeconds(Duration duration) {
        long millis = duration.toMillis();
        return (millis + 999) / 1000;
    }

    private static String newToken() {
        return UUID.randomUUID().toString();
    }
}
