package com.teambind.loyalty.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 쿠폰 종류
 * 표시 이름과 설명은 종류별 고정 테이블에서 결정됩니다.
 */
public enum CouponKind {

    FREE_EVENT("free_event", "무료 이벤트 참가권", "원하는 Solo Party 이벤트에 무료로 참가할 수 있습니다."),
    DISCOUNT("discount", "50% 할인 쿠폰", "이벤트 참가비 50% 할인을 받을 수 있습니다."),
    SPECIAL("special", "스페셜 쿠폰", "특별한 혜택이 담긴 프리미엄 쿠폰입니다.");

    private final String code;
    private final String displayName;
    private final String description;

    CouponKind(String code, String displayName, String description) {
        this.code = code;
        this.displayName = displayName;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 저장 포맷의 코드 값으로 종류 조회
     *
     * @param code 저장된 종류 코드 (예: "free_event")
     * @return 일치하는 종류, 알 수 없는 값이면 empty
     */
    public static Optional<CouponKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.code.equals(code))
                .findFirst();
    }
}
