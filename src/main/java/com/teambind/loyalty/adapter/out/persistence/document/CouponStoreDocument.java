package com.teambind.loyalty.adapter.out.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * 주 저장소 평문 구조
 * {coupons: [...], history: [...], totalExchanged, totalUsed}
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CouponStoreDocument {

    private List<CouponDocument> coupons;
    private List<CouponHistoryDocument> history;
    private Integer totalExchanged;
    private Integer totalUsed;
}
