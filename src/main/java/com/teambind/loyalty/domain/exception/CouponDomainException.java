package com.teambind.loyalty.domain.exception;

/**
 * 쿠폰 도메인 예외
 * 수명주기 서비스 경계에서 모두 결과 값으로 변환됩니다.
 */
public abstract class CouponDomainException extends RuntimeException {

    private final CouponErrorCode errorCode;

    protected CouponDomainException(CouponErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CouponDomainException(CouponErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public CouponErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 보안 난수 소스 사용 불가
     * 약한 난수로 대체하지 않고 발급을 중단해야 합니다.
     */
    public static class EntropyUnavailable extends CouponDomainException {
        public EntropyUnavailable(String message, Throwable cause) {
            super(CouponErrorCode.ENTROPY_UNAVAILABLE, message, cause);
        }
    }

    /**
     * 저장 레코드 손상 (형식 오류, 비정상 크기)
     */
    public static class CorruptedRecord extends CouponDomainException {
        public CorruptedRecord(String message) {
            super(CouponErrorCode.PERSISTENCE_FAILURE, message);
        }

        public CorruptedRecord(String message, Throwable cause) {
            super(CouponErrorCode.PERSISTENCE_FAILURE, message, cause);
        }
    }

    /**
     * 복호화 또는 무결성 검증 실패
     */
    public static class DecryptionFailed extends CouponDomainException {
        public DecryptionFailed(String message, Throwable cause) {
            super(CouponErrorCode.PERSISTENCE_FAILURE, message, cause);
        }
    }

    /**
     * 저장 매체 접근 실패
     */
    public static class StorageUnavailable extends CouponDomainException {
        public StorageUnavailable(String message) {
            super(CouponErrorCode.PERSISTENCE_FAILURE, message);
        }

        public StorageUnavailable(String message, Throwable cause) {
            super(CouponErrorCode.PERSISTENCE_FAILURE, message, cause);
        }
    }
}
