package com.teambind.loyalty.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.teambind.loyalty.support.CouponFixtures.NOW;
import static com.teambind.loyalty.support.CouponFixtures.VALIDITY;
import static com.teambind.loyalty.support.CouponFixtures.coupon;
import static com.teambind.loyalty.support.CouponFixtures.history;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CouponStore 테스트")
class CouponStoreTest {

    private final CouponStoreLimits limits = new CouponStoreLimits(3, 3, 5);

    @Nested
    @DisplayName("교환 쿠폰 추가")
    class WithExchangedCoupon {

        @Test
        @DisplayName("새 쿠폰과 이력을 맨 앞에 추가하고 교환 누적을 올린다")
        void prependsAndCounts() {
            // given
            CouponStore store = CouponStore.empty();
            Coupon first = coupon("coupon_1", "AAAA2222BBBB");
            Coupon second = coupon("coupon_2", "CCCC3333DDDD");

            // when
            CouponStore updated = store
                    .withExchangedCoupon(first, history("h1", HistoryAction.EXCHANGE, "coupon_1", NOW), limits)
                    .withExchangedCoupon(second, history("h2", HistoryAction.EXCHANGE, "coupon_2", NOW), limits);

            // then
            assertThat(updated.getCoupons()).extracting(Coupon::getId).containsExactly("coupon_2", "coupon_1");
            assertThat(updated.getHistory()).extracting(CouponHistory::getId).containsExactly("h2", "h1");
            assertThat(updated.getTotalExchanged()).isEqualTo(2);
            assertThat(store.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("보관 상한을 넘으면 가장 오래된 항목부터 제거한다")
        void capsOldestFirst() {
            // given
            CouponStore store = CouponStore.empty();
            String[] codes = {"AAAA2222BBBB", "CCCC3333DDDD", "EEEE4444FFFF", "GGGG5555HHHH"};

            // when
            for (int i = 0; i < codes.length; i++) {
                store = store.withExchangedCoupon(coupon("coupon_" + i, codes[i]),
                        history("h" + i, HistoryAction.EXCHANGE, "coupon_" + i, NOW), limits);
            }

            // then
            assertThat(store.getCoupons()).extracting(Coupon::getId)
                    .containsExactly("coupon_3", "coupon_2", "coupon_1");
            assertThat(store.getHistory()).hasSize(3);
            assertThat(store.getTotalExchanged()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("사용 쿠폰 교체")
    class WithUsedCoupon {

        @Test
        @DisplayName("같은 ID 쿠폰을 교체하고 사용 누적을 올린다")
        void replacesById() {
            // given
            Coupon original = coupon("coupon_1", "AAAA2222BBBB");
            CouponStore store = CouponStore.of(List.of(original), List.of(), 1, 0);
            Coupon used = original.markUsed(NOW.plusSeconds(60));

            // when
            CouponStore updated = store.withUsedCoupon(used,
                    history("h_use", HistoryAction.USE, "coupon_1", NOW.plusSeconds(60)), limits);

            // then
            assertThat(updated.findById("coupon_1")).contains(used);
            assertThat(updated.getTotalUsed()).isEqualTo(1);
            assertThat(updated.getHistory()).extracting(CouponHistory::getAction).containsExactly(HistoryAction.USE);
        }

        @Test
        @DisplayName("저장소에 없는 쿠폰이면 예외")
        void unknownCoupon() {
            Coupon stranger = coupon("coupon_x", "AAAA2222BBBB").markUsed(NOW);

            assertThatThrownBy(() -> CouponStore.empty().withUsedCoupon(stranger,
                    history("h", HistoryAction.USE, "coupon_x", NOW), limits))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("조회")
    class Queries {

        @Test
        @DisplayName("사용 가능 쿠폰은 미사용이면서 만료 전인 쿠폰")
        void availableCoupons() {
            // given
            Coupon available = coupon("coupon_1", "AAAA2222BBBB");
            Coupon used = coupon("coupon_2", "CCCC3333DDDD").markUsed(NOW);
            Coupon old = coupon("coupon_3", "EEEE4444FFFF", NOW.minus(VALIDITY).minus(Duration.ofDays(1)));
            CouponStore store = CouponStore.of(List.of(available, used, old), List.of(), 3, 1);

            // when & then
            assertThat(store.availableCoupons(NOW)).containsExactly(available);
            assertThat(store.countAvailable(NOW)).isEqualTo(1);
        }

        @Test
        @DisplayName("만료 시각과 같은 시점은 만료로 본다")
        void expiryBoundary() {
            Coupon coupon = coupon("coupon_1", "AAAA2222BBBB");

            assertThat(coupon.statusAt(coupon.getExpiresAt().minusMillis(1))).isEqualTo(CouponStatus.AVAILABLE);
            assertThat(coupon.statusAt(coupon.getExpiresAt())).isEqualTo(CouponStatus.EXPIRED);
        }

        @Test
        @DisplayName("목록은 외부에서 변경할 수 없다")
        void immutableLists() {
            List<Coupon> source = new ArrayList<>(List.of(coupon("coupon_1", "AAAA2222BBBB")));
            CouponStore store = CouponStore.of(source, List.of(), 1, 0);

            source.clear();

            assertThat(store.getCoupons()).hasSize(1);
            assertThatThrownBy(() -> store.getCoupons().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("음수 누적은 거부한다")
        void negativeTotals() {
            assertThatThrownBy(() -> CouponStore.of(List.of(), List.of(), -1, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("쿠폰 상태 전이")
    class CouponTransitions {

        @Test
        @DisplayName("코드 검증 사용은 사용 시각과 검증 시각을 함께 기록한다")
        void markVerified() {
            Coupon verified = coupon("coupon_1", "AAAA2222BBBB").markVerified(NOW.plusSeconds(10));

            assertThat(verified.isUsed()).isTrue();
            assertThat(verified.usedAt()).contains(NOW.plusSeconds(10));
            assertThat(verified.verifiedAt()).contains(NOW.plusSeconds(10));
        }

        @Test
        @DisplayName("사용된 쿠폰은 다시 사용할 수 없다")
        void usedIsTerminal() {
            Coupon used = coupon("coupon_1", "AAAA2222BBBB").markUsed(NOW);

            assertThatThrownBy(() -> used.markUsed(NOW)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> used.markVerified(NOW)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(used::expire).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("만료 처리는 사용 시각을 만료 시각으로 기록하고 검증 시각은 없다")
        void expire() {
            Coupon coupon = coupon("coupon_1", "AAAA2222BBBB");

            Coupon expired = coupon.expire();

            assertThat(expired.isUsed()).isTrue();
            assertThat(expired.usedAt()).contains(coupon.getExpiresAt());
            assertThat(expired.verifiedAt()).isEmpty();
        }
    }
}
