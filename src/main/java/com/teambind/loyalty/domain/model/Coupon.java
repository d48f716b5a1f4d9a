package com.teambind.loyalty.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 발급된 쿠폰 (불변 객체)
 *
 * 상태 전이 메서드는 새 인스턴스를 반환합니다.
 * 한번 사용 처리된 쿠폰은 미사용 상태로 되돌릴 수 없습니다.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public class Coupon {

    private final String id;
    private final CouponKind kind;
    private final String name;
    private final String description;
    private final SecretCode secretCode;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Instant usedAt;
    private final Instant verifiedAt;
    private final boolean used;

    /**
     * 신규 쿠폰 발급
     */
    public static Coupon issue(String id, CouponKind kind, SecretCode secretCode, Instant now, Duration validity) {
        return Coupon.builder()
                .id(id)
                .kind(kind)
                .name(kind.getDisplayName())
                .description(kind.getDescription())
                .secretCode(secretCode)
                .createdAt(now)
                .expiresAt(now.plus(validity))
                .used(false)
                .build();
    }

    public CouponStatus statusAt(Instant now) {
        if (used) {
            return CouponStatus.USED;
        }
        return now.isBefore(expiresAt) ? CouponStatus.AVAILABLE : CouponStatus.EXPIRED;
    }

    public boolean isAvailableAt(Instant now) {
        return statusAt(now) == CouponStatus.AVAILABLE;
    }

    public boolean isExpiredAt(Instant now) {
        return statusAt(now) == CouponStatus.EXPIRED;
    }

    public boolean hasSecretCode() {
        return secretCode != null;
    }

    public Optional<Instant> usedAt() {
        return Optional.ofNullable(usedAt);
    }

    public Optional<Instant> verifiedAt() {
        return Optional.ofNullable(verifiedAt);
    }

    /**
     * 앱 내 직접 사용 처리
     */
    public Coupon markUsed(Instant now) {
        ensureUnused();
        return toBuilder()
                .used(true)
                .usedAt(now)
                .build();
    }

    /**
     * 비밀 코드 검증을 통한 사용 처리
     * usedAt 과 verifiedAt 을 함께 기록합니다.
     */
    public Coupon markVerified(Instant now) {
        ensureUnused();
        return toBuilder()
                .used(true)
                .usedAt(now)
                .verifiedAt(now)
                .build();
    }

    /**
     * 만료 처리 (사용 시각은 만료 시각으로 기록)
     */
    public Coupon expire() {
        ensureUnused();
        return toBuilder()
                .used(true)
                .usedAt(expiresAt)
                .build();
    }

    public Coupon withSecretCode(SecretCode code) {
        return toBuilder().secretCode(code).build();
    }

    private void ensureUnused() {
        if (used) {
            throw new IllegalStateException("이미 사용된 쿠폰입니다: " + id);
        }
    }
}
