package com.teambind.loyalty.adapter.out.crypto;

import com.teambind.loyalty.adapter.out.storage.KeyValueStore;
import com.teambind.loyalty.domain.exception.CouponDomainException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 저장소 암호화 키 제공
 *
 * 설정된 키(base64, 256bit)가 있으면 그대로 사용하고, 없으면 보안 저장소에 보관한
 * 기기 고유 시드(최초 실행 시 32바이트 생성)를 SHA-256 으로 파생해 사용합니다.
 * 앱 재설치 등으로 시드가 사라지면 기존 주 저장소는 복호화할 수 없습니다.
 */
@Slf4j
public class DeviceKeyProvider {

    private static final String ALGORITHM = "AES";
    private static final int KEY_BYTES = 32;
    private static final int SEED_BYTES = 32;
    private static final String DERIVATION_LABEL = "coupon-store:";

    private final KeyValueStore secureStore;
    private final String seedKey;
    private final Supplier<SecureRandom> randomSource;
    private final byte[] configuredKey;

    private volatile SecretKey cachedKey;

    public DeviceKeyProvider(KeyValueStore secureStore, String seedKey,
                             Supplier<SecureRandom> randomSource, String configuredKeyBase64) {
        this.secureStore = secureStore;
        this.seedKey = seedKey;
        this.randomSource = randomSource;
        this.configuredKey = decodeConfiguredKey(configuredKeyBase64);
    }

    public SecretKey currentKey() {
        SecretKey key = cachedKey;
        if (key == null) {
            synchronized (this) {
                key = cachedKey;
                if (key == null) {
                    key = configuredKey != null
                            ? new SecretKeySpec(configuredKey, ALGORITHM)
                            : new SecretKeySpec(deriveFromSeed(loadOrCreateSeed()), ALGORITHM);
                    cachedKey = key;
                }
            }
        }
        return key;
    }

    private String loadOrCreateSeed() {
        Optional<String> stored = secureStore.get(seedKey);
        if (stored.isPresent() && !stored.get().isBlank()) {
            return stored.get();
        }

        byte[] seed = new byte[SEED_BYTES];
        try {
            randomSource.get().nextBytes(seed);
        } catch (RuntimeException e) {
            throw new CouponDomainException.EntropyUnavailable("암호화 시드 생성에 실패했습니다", e);
        }
        String seedHex = HexFormat.of().formatHex(seed);
        secureStore.put(seedKey, seedHex);
        log.info("기기 암호화 시드 생성 완료");
        return seedHex;
    }

    private static byte[] deriveFromSeed(String seedHex) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest((DERIVATION_LABEL + seedHex).getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 을 사용할 수 없습니다", e);
        }
    }

    private static byte[] decodeConfiguredKey(String base64) {
        if (base64 == null || base64.isBlank()) {
            return null;
        }
        byte[] key = Base64.getDecoder().decode(base64.trim());
        if (key.length != KEY_BYTES) {
            throw new IllegalArgumentException("암호화 키는 256bit(32바이트)여야 합니다");
        }
        return key;
    }
}
