package com.teambind.loyalty.adapter.out.crypto;

import com.teambind.loyalty.adapter.out.storage.InMemoryKeyValueStore;
import com.teambind.loyalty.domain.exception.CouponDomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StoreCipher 테스트")
class StoreCipherTest {

    private static final String SEED_KEY = "sp_enc_seed_v1";

    private InMemoryKeyValueStore secureStore;
    private StoreCipher cipher;

    @BeforeEach
    void setUp() {
        secureStore = new InMemoryKeyValueStore(2048);
        DeviceKeyProvider keyProvider = new DeviceKeyProvider(secureStore, SEED_KEY, SecureRandom::new, "");
        cipher = new StoreCipher(keyProvider, SecureRandom::new);
    }

    @Nested
    @DisplayName("암호화")
    class Encrypt {

        @Test
        @DisplayName("v1 접두사 형식으로 암호화하고 원문을 복원한다")
        void encryptDecrypt() {
            // given
            String plaintext = "{\"coupons\":[],\"history\":[],\"totalExchanged\":0,\"totalUsed\":0}";

            // when
            String encrypted = cipher.encrypt(plaintext);

            // then
            assertThat(encrypted).startsWith("v1:");
            assertThat(encrypted).doesNotContain("coupons");
            assertThat(cipher.decrypt(encrypted)).isEqualTo(plaintext);
        }

        @Test
        @DisplayName("같은 평문도 IV가 달라 매번 다른 암호문이 된다")
        void randomIv() {
            assertThat(cipher.encrypt("same")).isNotEqualTo(cipher.encrypt("same"));
        }

        @Test
        @DisplayName("최초 사용 시 기기 시드를 보안 저장소에 만든다")
        void createsDeviceSeed() {
            cipher.encrypt("x");

            assertThat(secureStore.get(SEED_KEY)).hasValueSatisfying(seed -> assertThat(seed).hasSize(64));
        }
    }

    @Nested
    @DisplayName("복호화 거부")
    class DecryptRejection {

        @Test
        @DisplayName("변조된 암호문은 DecryptionFailed")
        void tampered() {
            // given
            String encrypted = cipher.encrypt("{\"totalExchanged\":1}");
            byte[] raw = Base64.getDecoder().decode(encrypted.substring(3));
            raw[raw.length - 1] ^= 0x01;
            String tampered = "v1:" + Base64.getEncoder().encodeToString(raw);

            // when & then
            assertThatThrownBy(() -> cipher.decrypt(tampered))
                    .isInstanceOf(CouponDomainException.DecryptionFailed.class);
        }

        @Test
        @DisplayName("평문 JSON은 그대로 받아들이지 않는다")
        void plaintextNotAccepted() {
            assertThatThrownBy(() -> cipher.decrypt("{\"coupons\":[]}"))
                    .isInstanceOf(CouponDomainException.DecryptionFailed.class);
        }

        @Test
        @DisplayName("너무 짧거나 base64 가 아니면 DecryptionFailed")
        void malformed() {
            assertThatThrownBy(() -> cipher.decrypt("v1:AAAA"))
                    .isInstanceOf(CouponDomainException.DecryptionFailed.class);
            assertThatThrownBy(() -> cipher.decrypt("v1:!!!not-base64!!!"))
                    .isInstanceOf(CouponDomainException.DecryptionFailed.class);
        }

        @Test
        @DisplayName("다른 기기 시드로 암호화된 값은 복호화할 수 없다")
        void differentDevice() {
            // given
            String encrypted = cipher.encrypt("secret");
            InMemoryKeyValueStore otherDevice = new InMemoryKeyValueStore(2048);
            StoreCipher otherCipher = new StoreCipher(
                    new DeviceKeyProvider(otherDevice, SEED_KEY, SecureRandom::new, null), SecureRandom::new);

            // when & then
            assertThatThrownBy(() -> otherCipher.decrypt(encrypted))
                    .isInstanceOf(CouponDomainException.DecryptionFailed.class);
        }
    }

    @Nested
    @DisplayName("설정 키")
    class ConfiguredKey {

        @Test
        @DisplayName("설정된 256bit 키를 쓰면 시드를 만들지 않는다")
        void usesConfiguredKey() {
            // given
            String key = Base64.getEncoder().encodeToString(new byte[32]);
            StoreCipher configured = new StoreCipher(
                    new DeviceKeyProvider(secureStore, SEED_KEY, SecureRandom::new, key), SecureRandom::new);

            // when
            String encrypted = configured.encrypt("hello");

            // then
            assertThat(configured.decrypt(encrypted)).isEqualTo("hello");
            assertThat(secureStore.get(SEED_KEY)).isEmpty();
        }

        @Test
        @DisplayName("길이가 맞지 않는 키는 거부한다")
        void invalidKeyLength() {
            String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

            assertThatThrownBy(() -> new DeviceKeyProvider(secureStore, SEED_KEY, SecureRandom::new, shortKey))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
