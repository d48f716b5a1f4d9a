package com.teambind.loyalty.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SecretCode 테스트")
class SecretCodeTest {

    private static final String CODE = "ABCD2345EFGH";

    @Nested
    @DisplayName("정규화")
    class Normalize {

        @Test
        @DisplayName("구분자, 공백, 소문자를 정규화한다")
        void normalizesDisplayInput() {
            assertThat(SecretCode.normalize("  abcd-2345 efgh ")).isEqualTo(CODE);
            assertThat(SecretCode.normalize("ABCD-2345-EFGH")).isEqualTo(CODE);
        }

        @Test
        @DisplayName("null 입력은 빈 문자열")
        void nullInput() {
            assertThat(SecretCode.normalize(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("생성")
    class Create {

        @Test
        @DisplayName("표시 형식과 정규화 형식으로 같은 코드를 만든다")
        void sameCodeFromBothForms() {
            assertThat(SecretCode.of("abcd-2345-efgh")).isEqualTo(SecretCode.of(CODE));
        }

        @ParameterizedTest
        @ValueSource(strings = {"ABCD2345EFG", "ABCD2345EFGHJ", "ABCD2345EFG0", "ABCD2345EFGI", "ABCD2345EFGO", "ABCD2345EFG1"})
        @DisplayName("길이가 다르거나 혼동 문자가 포함되면 거부한다")
        void rejectsInvalid(String value) {
            assertThatThrownBy(() -> SecretCode.of(value))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("알파벳은 혼동 문자를 제외한 32자")
        void alphabet() {
            assertThat(SecretCode.ALPHABET).hasSize(32);
            assertThat(SecretCode.ALPHABET).doesNotContain("0", "O", "1", "I");
        }
    }

    @Nested
    @DisplayName("표시")
    class Display {

        @Test
        @DisplayName("XXXX-XXXX-XXXX 형식으로 표시한다")
        void formatted() {
            assertThat(SecretCode.of(CODE).formatted()).isEqualTo("ABCD-2345-EFGH");
        }

        @Test
        @DisplayName("로그에는 첫 그룹만 노출한다")
        void masked() {
            SecretCode code = SecretCode.of(CODE);

            assertThat(code.masked()).isEqualTo("ABCD-****-****");
            assertThat(code.toString()).doesNotContain("2345");
        }
    }

    @Nested
    @DisplayName("상수 시간 비교")
    class ConstantTimeCompare {

        @Test
        @DisplayName("같은 값만 일치한다")
        void equality() {
            assertThat(SecretCode.constantTimeEquals(CODE, CODE)).isTrue();
            assertThat(SecretCode.constantTimeEquals(CODE, "ABCD2345EFGJ")).isFalse();
            assertThat(SecretCode.constantTimeEquals(CODE, "XBCD2345EFGH")).isFalse();
        }

        @Test
        @DisplayName("길이가 다르면 접두사가 같아도 불일치")
        void lengthMismatch() {
            assertThat(SecretCode.constantTimeEquals(CODE, CODE + "A")).isFalse();
            assertThat(SecretCode.constantTimeEquals(CODE, CODE.substring(0, 11))).isFalse();
            assertThat(SecretCode.constantTimeEquals("", CODE)).isFalse();
            assertThat(SecretCode.constantTimeEquals(null, null)).isTrue();
        }

        @Test
        @DisplayName("정규화된 입력과 matches 로 비교한다")
        void matches() {
            SecretCode code = SecretCode.of(CODE);

            assertThat(code.matches(SecretCode.normalize("abcd-2345-efgh"))).isTrue();
            assertThat(code.matches("ABCD2345EFGG")).isFalse();
        }

        @Test
        @DisplayName("첫 글자 불일치와 마지막 글자 불일치의 소요 시간이 크게 다르지 않다")
        void timingIndependentOfMismatchPosition() {
            String firstDiffers = "ZBCD2345EFGH";
            String lastDiffers = "ABCD2345EFGZ";

            // 워밍업
            for (int i = 0; i < 200_000; i++) {
                SecretCode.constantTimeEquals(CODE, firstDiffers);
                SecretCode.constantTimeEquals(CODE, lastDiffers);
            }

            long early = medianNanos(CODE, firstDiffers);
            long late = medianNanos(CODE, lastDiffers);

            double ratio = (double) Math.max(early, 1) / Math.max(late, 1);
            assertThat(ratio).isBetween(0.2, 5.0);
        }

        private long medianNanos(String a, String b) {
            int rounds = 51;
            long[] samples = new long[rounds];
            boolean sink = false;
            for (int r = 0; r < rounds; r++) {
                long start = System.nanoTime();
                for (int i = 0; i < 20_000; i++) {
                    sink ^= SecretCode.constantTimeEquals(a, b);
                }
                samples[r] = System.nanoTime() - start;
            }
            assertThat(sink).isFalse();
            Arrays.sort(samples);
            return samples[rounds / 2];
        }
    }
}
