package com.teambind.loyalty.adapter.out.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.teambind.loyalty.domain.model.CouponHistory;
import com.teambind.loyalty.domain.model.HistoryAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Optional;

/**
 * 쿠폰 이력 저장 문서
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CouponHistoryDocument {

    private String id;
    private String action;
    private String couponId;
    private String couponName;
    private Long pointsSpent;
    private Long timestamp;

    public static CouponHistoryDocument from(CouponHistory history) {
        return CouponHistoryDocument.builder()
                .id(history.getId())
                .action(history.getAction().getCode())
                .couponId(history.getCouponId())
                .couponName(history.getCouponName())
                .pointsSpent(history.getPointsSpent())
                .timestamp(history.getTimestamp().toEpochMilli())
                .build();
    }

    public Optional<CouponHistory> toDomain() {
        if (id == null || couponId == null || timestamp == null) {
            return Optional.empty();
        }
        return HistoryAction.fromCode(action)
                .map(historyAction -> CouponHistory.builder()
                        .id(id)
                        .action(historyAction)
                        .couponId(couponId)
                        .couponName(couponName != null ? couponName : "")
                        .pointsSpent(pointsSpent)
                        .timestamp(Instant.ofEpochMilli(timestamp))
                        .build());
    }
}
