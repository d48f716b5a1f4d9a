package com.teambind.loyalty.adapter.out.crypto;

import com.teambind.loyalty.domain.exception.CouponDomainException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.function.Supplier;

/**
 * 주 저장소 암호화 (AES-256-GCM)
 *
 * 형식: "v1:" + base64(IV 12바이트 || 암호문 || 인증 태그 16바이트)
 * 복호화나 태그 검증에 실패한 값은 평문으로 해석하지 않고 DecryptionFailed 로 거부합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class StoreCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String FORMAT_PREFIX = "v1:";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;

    private final DeviceKeyProvider keyProvider;
    private final Supplier<SecureRandom> randomSource;

    public String encrypt(String plaintext) {
        byte[] iv = new byte[GCM_IV_LENGTH];
        try {
            randomSource.get().nextBytes(iv);
        } catch (RuntimeException e) {
            throw new CouponDomainException.EntropyUnavailable("IV 생성에 실패했습니다", e);
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keyProvider.currentKey(), new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] encryptedWithIv = new byte[iv.length + cipherText.length];
            System.arraycopy(iv, 0, encryptedWithIv, 0, iv.length);
            System.arraycopy(cipherText, 0, encryptedWithIv, iv.length, cipherText.length);

            return FORMAT_PREFIX + Base64.getEncoder().encodeToString(encryptedWithIv);
        } catch (GeneralSecurityException e) {
            log.error("저장소 암호화 실패", e);
            throw new CouponDomainException.StorageUnavailable("저장소 암호화에 실패했습니다", e);
        }
    }

    public String decrypt(String encrypted) {
        if (encrypted == null || !encrypted.startsWith(FORMAT_PREFIX)) {
            throw new CouponDomainException.DecryptionFailed("알 수 없는 저장 형식입니다", null);
        }

        try {
            byte[] encryptedWithIv = Base64.getDecoder().decode(encrypted.substring(FORMAT_PREFIX.length()));
            if (encryptedWithIv.length < GCM_IV_LENGTH + GCM_TAG_LENGTH) {
                throw new CouponDomainException.DecryptionFailed("암호문 길이가 올바르지 않습니다", null);
            }

            byte[] iv = Arrays.copyOfRange(encryptedWithIv, 0, GCM_IV_LENGTH);
            byte[] cipherText = Arrays.copyOfRange(encryptedWithIv, GCM_IV_LENGTH, encryptedWithIv.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keyProvider.currentKey(), new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.warn("저장소 복호화 실패 - 변조 또는 다른 키로 암호화된 데이터: {}", e.getClass().getSimpleName());
            throw new CouponDomainException.DecryptionFailed("저장소 복호화에 실패했습니다", e);
        }
    }
}
