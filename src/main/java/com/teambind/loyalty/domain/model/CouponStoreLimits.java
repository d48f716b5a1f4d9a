package com.teambind.loyalty.domain.model;

/**
 * 쿠폰 저장소 크기 제한
 *
 * @param maxStoredCoupons     보관 쿠폰 최대 수 (사용 완료 포함)
 * @param maxHistory           이력 최대 수
 * @param corruptionMultiplier 저장 레코드가 제한의 이 배수를 넘으면 손상으로 간주
 */
public record CouponStoreLimits(int maxStoredCoupons, int maxHistory, int corruptionMultiplier) {

    public CouponStoreLimits {
        if (maxStoredCoupons <= 0 || maxHistory <= 0 || corruptionMultiplier < 1) {
            throw new IllegalArgumentException("저장소 제한 값이 올바르지 않습니다");
        }
    }

    public boolean exceedsSaneSize(int couponCount, int historyCount) {
        return couponCount > (long) maxStoredCoupons * corruptionMultiplier
                || historyCount > (long) maxHistory * corruptionMultiplier;
    }
}
