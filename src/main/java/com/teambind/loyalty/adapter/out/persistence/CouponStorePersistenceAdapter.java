package com.teambind.loyalty.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teambind.loyalty.adapter.out.crypto.StoreCipher;
import com.teambind.loyalty.adapter.out.persistence.document.CouponBackupDocument;
import com.teambind.loyalty.adapter.out.persistence.document.CouponDocument;
import com.teambind.loyalty.adapter.out.persistence.document.CouponHistoryDocument;
import com.teambind.loyalty.adapter.out.persistence.document.CouponStoreDocument;
import com.teambind.loyalty.adapter.out.storage.KeyValueStore;
import com.teambind.loyalty.application.port.out.LoadCouponStorePort;
import com.teambind.loyalty.application.port.out.SaveCouponStorePort;
import com.teambind.loyalty.common.config.CouponEngineProperties;
import com.teambind.loyalty.domain.exception.CouponDomainException;
import com.teambind.loyalty.domain.model.Coupon;
import com.teambind.loyalty.domain.model.CouponHistory;
import com.teambind.loyalty.domain.model.CouponKind;
import com.teambind.loyalty.domain.model.CouponStore;
import com.teambind.loyalty.domain.model.CouponStoreLimits;
import com.teambind.loyalty.domain.model.SecretCode;
import com.teambind.loyalty.domain.service.CouponStoreRepairer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 쿠폰 저장소 영속성 어댑터
 *
 * 저장: JSON 직렬화 → AES-GCM 암호화 → 주 저장소 기록 → 보안 저장소 백업 기록 → 주 저장소 재조회 검증
 * 조회: 주 저장소 복호화 → (실패 시) 백업에서 재구성 → (실패 시) 빈 저장소, 이후 보정 적용
 *
 * 레코드가 없거나 무효인 경우만 빈 저장소로 간주합니다.
 * 저장 매체를 읽을 수 없으면 StorageUnavailable 을 그대로 던집니다.
 */
@Slf4j
@RequiredArgsConstructor
public class CouponStorePersistenceAdapter implements LoadCouponStorePort, SaveCouponStorePort {

    private final KeyValueStore primaryStore;
    private final KeyValueStore secureStore;
    private final StoreCipher storeCipher;
    private final ObjectMapper objectMapper;
    private final CouponStoreRepairer repairer;
    private final CouponEngineProperties properties;
    private final Clock clock;

    @Override
    public boolean save(CouponStore store) {
        String encrypted;
        try {
            String plaintext = objectMapper.writeValueAsString(toDocument(store));
            encrypted = storeCipher.encrypt(plaintext);
            primaryStore.put(properties.getPrimaryKey(), encrypted);
        } catch (JsonProcessingException e) {
            log.error("쿠폰 저장소 직렬화 실패", e);
            return false;
        } catch (CouponDomainException e) {
            log.error("쿠폰 저장소 기록 실패 - error: {}", e.getMessage(), e);
            return false;
        }

        writeBackup(store);

        try {
            Optional<String> readBack = primaryStore.get(properties.getPrimaryKey());
            if (readBack.isEmpty() || !readBack.get().equals(encrypted)) {
                log.error("쿠폰 저장소 기록 검증 실패 - 재조회 값 불일치");
                return false;
            }
        } catch (CouponDomainException e) {
            log.error("쿠폰 저장소 기록 검증 중 오류 - error: {}", e.getMessage(), e);
            return false;
        }

        log.debug("쿠폰 저장소 저장 완료 - coupons: {}, history: {}",
                store.getCoupons().size(), store.getHistory().size());
        return true;
    }

    @Override
    public CouponStore load() {
        CouponStoreLimits limits = properties.storeLimits();

        Optional<CouponStore> primary = readPrimary(limits);
        boolean restoredFromBackup = false;
        CouponStore loaded;

        if (primary.isPresent()) {
            loaded = primary.get();
        } else {
            Optional<CouponStore> backup = readBackup();
            if (backup.isPresent()) {
                log.warn("주 저장소를 사용할 수 없어 백업에서 복원합니다 - coupons: {}",
                        backup.get().getCoupons().size());
                loaded = backup.get();
                restoredFromBackup = true;
            } else {
                log.info("저장된 쿠폰 데이터가 없습니다 - 빈 저장소로 시작");
                return CouponStore.empty();
            }
        }

        CouponStoreRepairer.RepairResult repair = repairer.repair(loaded, clock.instant(), limits);

        if (repair.changed() || restoredFromBackup) {
            if (!save(repair.store())) {
                log.warn("보정된 쿠폰 저장소 재기록 실패 - 다음 적재 시 다시 보정됩니다");
            }
        }
        return repair.store();
    }

    private Optional<CouponStore> readPrimary(CouponStoreLimits limits) {
        Optional<String> raw;
        try {
            raw = primaryStore.get(properties.getPrimaryKey());
        } catch (CouponDomainException.StorageUnavailable e) {
            log.error("주 저장소 조회 실패 - 적재 중단 - error: {}", e.getMessage());
            throw e;
        }
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }

        try {
            String plaintext = storeCipher.decrypt(raw.get());
            CouponStoreDocument document = objectMapper.readValue(plaintext, CouponStoreDocument.class);
            return Optional.of(fromDocument(document, limits));
        } catch (CouponDomainException.StorageUnavailable e) {
            // 암호화 시드 조회 실패
            throw e;
        } catch (CouponDomainException e) {
            log.warn("주 저장소 레코드 무효 - {}", e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("주 저장소 JSON 파싱 실패 - {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private CouponStore fromDocument(CouponStoreDocument document, CouponStoreLimits limits) {
        if (document.getCoupons() == null || document.getHistory() == null) {
            throw new CouponDomainException.CorruptedRecord("쿠폰 또는 이력 배열이 없습니다");
        }
        if (limits.exceedsSaneSize(document.getCoupons().size(), document.getHistory().size())) {
            throw new CouponDomainException.CorruptedRecord(String.format(
                    "비정상 크기 레코드 - coupons: %d, history: %d",
                    document.getCoupons().size(), document.getHistory().size()));
        }

        List<Coupon> coupons = document.getCoupons().stream()
                .filter(Objects::nonNull)
                .map(CouponDocument::toDomain)
                .flatMap(Optional::stream)
                .toList();
        List<CouponHistory> history = document.getHistory().stream()
                .filter(Objects::nonNull)
                .map(CouponHistoryDocument::toDomain)
                .flatMap(Optional::stream)
                .toList();

        int dropped = document.getCoupons().size() - coupons.size()
                + document.getHistory().size() - history.size();
        if (dropped > 0) {
            log.warn("형식이 잘못된 항목 제거 - count: {}", dropped);
        }

        return CouponStore.of(coupons, history,
                nonNegative(document.getTotalExchanged()),
                nonNegative(document.getTotalUsed()));
    }

    private CouponStoreDocument toDocument(CouponStore store) {
        return CouponStoreDocument.builder()
                .coupons(store.getCoupons().stream().map(CouponDocument::from).toList())
                .history(store.getHistory().stream().map(CouponHistoryDocument::from).toList())
                .totalExchanged(store.getTotalExchanged())
                .totalUsed(store.getTotalUsed())
                .build();
    }

    // ==================== 백업 ====================

    private void writeBackup(CouponStore store) {
        int limit = Math.min(properties.getBackupMaxBytes(), secureStore.maxValueBytes());
        try {
            String payload = objectMapper.writeValueAsString(trimmedBackup(store));
            if (utf8Length(payload) > limit) {
                log.warn("백업 크기 초과 - 메타데이터만 저장합니다 - size: {}, limit: {}", utf8Length(payload), limit);
                payload = objectMapper.writeValueAsString(metadataBackup(store));
            }
            if (utf8Length(payload) > limit) {
                log.error("메타데이터 백업도 크기 한도를 초과합니다 - limit: {}", limit);
                return;
            }
            secureStore.put(properties.getBackupKey(), payload);
        } catch (JsonProcessingException e) {
            log.warn("백업 직렬화 실패", e);
        } catch (CouponDomainException e) {
            log.warn("백업 기록 실패 - error: {}", e.getMessage());
        }
    }

    private CouponBackupDocument trimmedBackup(CouponStore store) {
        List<CouponBackupDocument.BackupCoupon> unused = store.getCoupons().stream()
                .filter(coupon -> !coupon.isUsed())
                .limit(properties.getBackupMaxCoupons())
                .map(coupon -> CouponBackupDocument.BackupCoupon.builder()
                        .id(coupon.getId())
                        .code(coupon.hasSecretCode() ? coupon.getSecretCode().value() : null)
                        .type(coupon.getKind().getCode())
                        .name(coupon.getName())
                        .createdAt(coupon.getCreatedAt().toEpochMilli())
                        .expiresAt(coupon.getExpiresAt().toEpochMilli())
                        .used(false)
                        .build())
                .toList();

        return CouponBackupDocument.builder()
                .version(CouponBackupDocument.CURRENT_VERSION)
                .metadataOnly(false)
                .coupons(unused)
                .totalExchanged(store.getTotalExchanged())
                .totalUsed(store.getTotalUsed())
                .savedAt(clock.millis())
                .build();
    }

    private CouponBackupDocument metadataBackup(CouponStore store) {
        return CouponBackupDocument.builder()
                .version(CouponBackupDocument.CURRENT_VERSION)
                .metadataOnly(true)
                .couponCount(store.getCoupons().size())
                .totalExchanged(store.getTotalExchanged())
                .totalUsed(store.getTotalUsed())
                .savedAt(clock.millis())
                .build();
    }

    private Optional<CouponStore> readBackup() {
        try {
            Optional<String> raw = secureStore.get(properties.getBackupKey());
            if (raw.isEmpty() || raw.get().isBlank()) {
                return Optional.empty();
            }

            CouponBackupDocument backup = objectMapper.readValue(raw.get(), CouponBackupDocument.class);
            if (backup.getVersion() == null || backup.getVersion() != CouponBackupDocument.CURRENT_VERSION) {
                log.warn("지원하지 않는 백업 버전 - version: {}", backup.getVersion());
                return Optional.empty();
            }

            List<Coupon> coupons = new ArrayList<>();
            if (!Boolean.TRUE.equals(backup.getMetadataOnly()) && backup.getCoupons() != null) {
                for (CouponBackupDocument.BackupCoupon entry : backup.getCoupons()) {
                    toCoupon(entry).ifPresent(coupons::add);
                }
            }

            return Optional.of(CouponStore.of(coupons, List.of(),
                    nonNegative(backup.getTotalExchanged()),
                    nonNegative(backup.getTotalUsed())));
        } catch (JsonProcessingException e) {
            log.warn("백업 JSON 파싱 실패 - {}", e.getOriginalMessage());
            return Optional.empty();
        } catch (CouponDomainException.StorageUnavailable e) {
            log.error("백업 조회 실패 - 적재 중단 - error: {}", e.getMessage());
            throw e;
        }
    }

    private static Optional<Coupon> toCoupon(CouponBackupDocument.BackupCoupon entry) {
        if (entry == null || entry.getId() == null || entry.getCreatedAt() == null || entry.getExpiresAt() == null) {
            return Optional.empty();
        }
        Optional<CouponKind> kind = CouponKind.fromCode(entry.getType());
        if (kind.isEmpty()) {
            return Optional.empty();
        }

        SecretCode code = null;
        if (entry.getCode() != null) {
            try {
                code = SecretCode.of(entry.getCode());
            } catch (IllegalArgumentException e) {
                log.debug("백업 쿠폰 코드 형식 오류 - couponId: {}", entry.getId());
            }
        }

        return Optional.of(Coupon.builder()
                .id(entry.getId())
                .kind(kind.get())
                .name(entry.getName() != null ? entry.getName() : kind.get().getDisplayName())
                .description(kind.get().getDescription())
                .secretCode(code)
                .createdAt(Instant.ofEpochMilli(entry.getCreatedAt()))
                .expiresAt(Instant.ofEpochMilli(entry.getExpiresAt()))
                .used(Boolean.TRUE.equals(entry.getUsed()))
                .build());
    }

    private static int nonNegative(Integer value) {
        return value == null ? 0 : Math.max(0, value);
    }

    private static int utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }
}
