package com.teambind.loyalty.domain.model;

import lombok.EqualsAndHashCode;

import java.util.Locale;

/**
 * 쿠폰 비밀 코드 (Value Object)
 *
 * 저장/비교는 구분자가 없는 정규화 값(12자)으로, 표시는 XXXX-XXXX-XXXX 형식으로 합니다.
 */
@EqualsAndHashCode
public final class SecretCode {

    public static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    public static final int LENGTH = 12;
    public static final int GROUP_SIZE = 4;
    public static final char DELIMITER = '-';

    private final String normalized;

    private SecretCode(String normalized) {
        this.normalized = normalized;
    }

    /**
     * 표시 형식 또는 정규화 형식 문자열로부터 생성
     *
     * @throws IllegalArgumentException 길이 또는 문자 집합이 맞지 않는 경우
     */
    public static SecretCode of(String value) {
        String candidate = normalize(value);
        if (candidate.length() != LENGTH) {
            throw new IllegalArgumentException("비밀 코드는 " + LENGTH + "자여야 합니다");
        }
        for (int i = 0; i < candidate.length(); i++) {
            if (ALPHABET.indexOf(candidate.charAt(i)) < 0) {
                throw new IllegalArgumentException("허용되지 않은 문자가 포함되어 있습니다");
            }
        }
        return new SecretCode(candidate);
    }

    /**
     * 사용자 입력 정규화
     * 앞뒤 공백 제거, 대문자 변환, 공백과 구분자 제거
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String upper = raw.trim().toUpperCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (c == DELIMITER || Character.isWhitespace(c)) {
                continue;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * 상수 시간 비교
     *
     * 첫 불일치 위치와 무관하게 항상 긴 쪽 길이만큼 순회하며,
     * 길이 차이도 결과 누적값에 포함합니다.
     */
    public static boolean constantTimeEquals(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int maxLength = Math.max(left.length(), right.length());
        int result = left.length() ^ right.length();

        for (int i = 0; i < maxLength; i++) {
            int charA = i < left.length() ? left.charAt(i) : 0;
            int charB = i < right.length() ? right.charAt(i) : 0;
            result |= charA ^ charB;
        }
        return result == 0;
    }

    /**
     * 정규화된 입력과 상수 시간으로 일치 여부 확인
     */
    public boolean matches(String normalizedInput) {
        return constantTimeEquals(normalized, normalizedInput);
    }

    public String value() {
        return normalized;
    }

    public String formatted() {
        StringBuilder sb = new StringBuilder(LENGTH + LENGTH / GROUP_SIZE);
        for (int i = 0; i < normalized.length(); i++) {
            if (i > 0 && i % GROUP_SIZE == 0) {
                sb.append(DELIMITER);
            }
            sb.append(normalized.charAt(i));
        }
        return sb.toString();
    }

    /**
     * 로그용 마스킹 (첫 그룹만 노출)
     */
    public String masked() {
        return normalized.substring(0, GROUP_SIZE) + DELIMITER + "****" + DELIMITER + "****";
    }

    @Override
    public String toString() {
        return masked();
    }
}
