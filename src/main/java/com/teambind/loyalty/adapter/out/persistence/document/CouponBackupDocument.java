package com.teambind.loyalty.adapter.out.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * 보안 저장소 백업 문서 (약 2KB 제한)
 *
 * 미사용 쿠폰 일부를 담거나, 크기가 넘치면 카운트만 담습니다(metadataOnly).
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CouponBackupDocument {

    public static final int CURRENT_VERSION = 1;

    private Integer version;
    private Boolean metadataOnly;
    private List<BackupCoupon> coupons;
    private Integer couponCount;
    private Integer totalExchanged;
    private Integer totalUsed;
    private Long savedAt;

    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackupCoupon {
        private String id;
        private String code;
        private String type;
        private String name;
        private Long createdAt;
        private Long expiresAt;

        @JsonProperty("isUsed")
        private Boolean used;
    }
}
