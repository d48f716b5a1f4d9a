package com.teambind.loyalty.common;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.util.Set;

/**
 * 자기 검증 기능을 제공하는 추상 클래스
 * 하위 커맨드는 생성자 마지막에 validateSelf() 를 호출합니다.
 */
public abstract class SelfValidating<T> {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    /**
     * 객체의 유효성을 검증합니다.
     * @throws ConstraintViolationException 유효성 검증 실패 시
     */
    protected void validateSelf() {
        @SuppressWarnings("unchecked")
        Set<ConstraintViolation<T>> violations = VALIDATOR.validate((T) this);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
    }
}
