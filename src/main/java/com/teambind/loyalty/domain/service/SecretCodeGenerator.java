package com.teambind.loyalty.domain.service;

import com.teambind.loyalty.domain.exception.CouponDomainException;
import com.teambind.loyalty.domain.model.SecretCode;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.function.Supplier;

/**
 * 쿠폰 비밀 코드 생성기
 *
 * 보안 난수 12바이트로 32자 알파벳의 인덱스를 고릅니다.
 * 256은 32의 배수이므로 하위 5비트만 사용해도 편향이 없습니다.
 * 보안 난수를 얻지 못하면 약한 생성기로 대체하지 않고 EntropyUnavailable 을 던집니다.
 */
@Slf4j
public class SecretCodeGenerator {

    private static final int INDEX_MASK = SecretCode.ALPHABET.length() - 1;

    private final Supplier<SecureRandom> randomSource;
    private volatile SecureRandom random;

    public SecretCodeGenerator(Supplier<SecureRandom> randomSource) {
        this.randomSource = randomSource;
    }

    public SecretCode generate() {
        byte[] bytes = new byte[SecretCode.LENGTH];
        try {
            secureRandom().nextBytes(bytes);
        } catch (CouponDomainException.EntropyUnavailable e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("보안 난수 생성 실패", e);
            throw new CouponDomainException.EntropyUnavailable("보안 난수 생성에 실패했습니다", e);
        }

        StringBuilder sb = new StringBuilder(SecretCode.LENGTH);
        for (byte b : bytes) {
            sb.append(SecretCode.ALPHABET.charAt(b & INDEX_MASK));
        }
        return SecretCode.of(sb.toString());
    }

    private SecureRandom secureRandom() {
        SecureRandom current = random;
        if (current == null) {
            synchronized (this) {
                current = random;
                if (current == null) {
                    current = randomSource.get();
                    if (current == null) {
                        throw new CouponDomainException.EntropyUnavailable("보안 난수 소스가 없습니다", null);
                    }
                    random = current;
                }
            }
        }
        return current;
    }
}
