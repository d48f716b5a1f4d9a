package com.teambind.loyalty.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 쿠폰 저장소 (Aggregate Root)
 *
 * 기기(사용자)당 하나. 쿠폰과 이력은 최신 항목이 앞에 오도록 보관합니다.
 * 모든 변경 메서드는 새 인스턴스를 반환하므로, 영속화에 성공한 뒤에만
 * 새 상태를 공개하는 방식으로 사용합니다.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public class CouponStore {

    private final List<Coupon> coupons;
    private final List<CouponHistory> history;
    private final int totalExchanged;
    private final int totalUsed;

    public static CouponStore empty() {
        return new CouponStore(List.of(), List.of(), 0, 0);
    }

    public static CouponStore of(List<Coupon> coupons, List<CouponHistory> history,
                                 int totalExchanged, int totalUsed) {
        if (totalExchanged < 0 || totalUsed < 0) {
            throw new IllegalArgumentException("누적 카운트는 음수일 수 없습니다");
        }
        return new CouponStore(List.copyOf(coupons), List.copyOf(history), totalExchanged, totalUsed);
    }

    public Optional<Coupon> findById(String couponId) {
        return coupons.stream()
                .filter(coupon -> coupon.getId().equals(couponId))
                .findFirst();
    }

    public List<Coupon> availableCoupons(Instant now) {
        return coupons.stream()
                .filter(coupon -> coupon.isAvailableAt(now))
                .toList();
    }

    public int countAvailable(Instant now) {
        return (int) coupons.stream()
                .filter(coupon -> coupon.isAvailableAt(now))
                .count();
    }

    public boolean isEmpty() {
        return coupons.isEmpty() && history.isEmpty() && totalExchanged == 0 && totalUsed == 0;
    }

    /**
     * 교환으로 발급된 쿠폰 추가
     */
    public CouponStore withExchangedCoupon(Coupon coupon, CouponHistory entry, CouponStoreLimits limits) {
        List<Coupon> newCoupons = new ArrayList<>(coupons.size() + 1);
        newCoupons.add(coupon);
        newCoupons.addAll(coupons);

        return new CouponStore(
                cap(newCoupons, limits.maxStoredCoupons()),
                prepend(history, List.of(entry), limits.maxHistory()),
                totalExchanged + 1,
                totalUsed);
    }

    /**
     * 사용 처리된 쿠폰으로 교체
     */
    public CouponStore withUsedCoupon(Coupon usedCoupon, CouponHistory entry, CouponStoreLimits limits) {
        List<Coupon> newCoupons = new ArrayList<>(coupons.size());
        boolean replaced = false;
        for (Coupon coupon : coupons) {
            if (coupon.getId().equals(usedCoupon.getId())) {
                newCoupons.add(usedCoupon);
                replaced = true;
            } else {
                newCoupons.add(coupon);
            }
        }
        if (!replaced) {
            throw new IllegalArgumentException("저장소에 없는 쿠폰입니다: " + usedCoupon.getId());
        }

        return new CouponStore(
                List.copyOf(newCoupons),
                prepend(history, List.of(entry), limits.maxHistory()),
                totalExchanged,
                totalUsed + 1);
    }

    /**
     * 쿠폰 목록 교체와 이력 선두 추가 (복구용)
     */
    public CouponStore withRepairs(List<Coupon> repairedCoupons, List<CouponHistory> leadingHistory,
                                   CouponStoreLimits limits) {
        return new CouponStore(
                cap(repairedCoupons, limits.maxStoredCoupons()),
                prepend(history, leadingHistory, limits.maxHistory()),
                totalExchanged,
                totalUsed);
    }

    private static List<CouponHistory> prepend(List<CouponHistory> existing, List<CouponHistory> leading, int max) {
        List<CouponHistory> merged = new ArrayList<>(leading.size() + existing.size());
        merged.addAll(leading);
        merged.addAll(existing);
        return cap(merged, max);
    }

    private static <T> List<T> cap(List<T> items, int max) {
        if (items.size() <= max) {
            return List.copyOf(items);
        }
        return List.copyOf(items.subList(0, max));
    }
}
