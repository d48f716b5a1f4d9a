package com.teambind.loyalty.domain.exception;

/**
 * 쿠폰 연산 실패 코드
 * 모든 실패는 예외가 아닌 결과 값으로 호출자에게 전달됩니다.
 */
public enum CouponErrorCode {

    // 사용자 복구 가능
    COOLDOWN("잠시 후 다시 시도해주세요."),
    INSUFFICIENT_BALANCE("포인트가 부족합니다."),
    CAPACITY_EXCEEDED("보유 가능한 쿠폰 수를 초과했습니다."),
    NOT_FOUND("쿠폰을 찾을 수 없습니다."),
    ALREADY_USED("이미 사용된 쿠폰입니다."),
    EXPIRED("만료된 쿠폰입니다."),
    INVALID_INPUT("쿠폰 코드 형식이 올바르지 않습니다."),

    // 동시성
    BUSY("다른 요청을 처리 중입니다. 잠시 후 다시 시도해주세요."),

    // 인프라
    PERSISTENCE_FAILURE("쿠폰 정보를 저장하지 못했습니다."),
    ENTROPY_UNAVAILABLE("보안 난수를 사용할 수 없어 쿠폰을 발급할 수 없습니다."),
    LEDGER_FAILURE("포인트 차감에 실패했습니다. 다시 시도해주세요."),
    UNEXPECTED_ERROR("쿠폰 처리 중 오류가 발생했습니다."),

    // 남용 방지
    LOCKED_OUT("인증 시도 횟수를 초과했습니다.");

    private final String defaultMessage;

    CouponErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
