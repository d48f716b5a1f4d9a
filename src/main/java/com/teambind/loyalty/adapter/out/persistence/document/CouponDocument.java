package com.teambind.loyalty.adapter.out.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.teambind.loyalty.domain.model.Coupon;
import com.teambind.loyalty.domain.model.CouponKind;
import com.teambind.loyalty.domain.model.SecretCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Optional;

/**
 * 쿠폰 저장 문서 (주 저장소 JSON)
 * 시각은 epoch 밀리초로 저장합니다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CouponDocument {

    private String id;
    private String type;
    private String name;
    private String description;
    private String secretCode;
    private Long createdAt;
    private Long expiresAt;
    private Long usedAt;
    private Long verifiedAt;

    @JsonProperty("isUsed")
    private Boolean used;

    public static CouponDocument from(Coupon coupon) {
        return CouponDocument.builder()
                .id(coupon.getId())
                .type(coupon.getKind().getCode())
                .name(coupon.getName())
                .description(coupon.getDescription())
                .secretCode(coupon.hasSecretCode() ? coupon.getSecretCode().value() : null)
                .createdAt(coupon.getCreatedAt().toEpochMilli())
                .expiresAt(coupon.getExpiresAt().toEpochMilli())
                .usedAt(coupon.usedAt().map(Instant::toEpochMilli).orElse(null))
                .verifiedAt(coupon.verifiedAt().map(Instant::toEpochMilli).orElse(null))
                .used(coupon.isUsed())
                .build();
    }

    /**
     * 도메인 변환
     * 필수 값(ID, 종류, 생성/만료 시각)이 없거나 잘못된 항목은 empty.
     * 이름/설명이 없는 구버전 항목은 종류 테이블 값으로 채우고,
     * 형식이 맞지 않는 비밀 코드는 없는 것으로 보고 재발급 대상이 됩니다.
     */
    public Optional<Coupon> toDomain() {
        if (id == null || id.isBlank() || createdAt == null || expiresAt == null) {
            return Optional.empty();
        }
        Optional<CouponKind> kind = CouponKind.fromCode(type);
        if (kind.isEmpty()) {
            return Optional.empty();
        }

        boolean isUsed = Boolean.TRUE.equals(used);
        return Optional.of(Coupon.builder()
                .id(id)
                .kind(kind.get())
                .name(name != null ? name : kind.get().getDisplayName())
                .description(description != null ? description : kind.get().getDescription())
                .secretCode(parseCode(secretCode))
                .createdAt(Instant.ofEpochMilli(createdAt))
                .expiresAt(Instant.ofEpochMilli(expiresAt))
                .usedAt(usedAt != null ? Instant.ofEpochMilli(usedAt) : null)
                .verifiedAt(verifiedAt != null ? Instant.ofEpochMilli(verifiedAt) : null)
                .used(isUsed)
                .build());
    }

    private static SecretCode parseCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return SecretCode.of(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
