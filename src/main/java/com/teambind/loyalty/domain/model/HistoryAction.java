package com.teambind.loyalty.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 쿠폰 이력 액션
 */
public enum HistoryAction {

    EXCHANGE("exchange"),
    USE("use"),
    EXPIRE("expire");

    private final String code;

    HistoryAction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<HistoryAction> fromCode(String code) {
        return Arrays.stream(values())
                .filter(action -> action.code.equals(code))
                .findFirst();
    }
}
