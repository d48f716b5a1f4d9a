package com.teambind.loyalty.adapter.out.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 코드 검증 잠금 레코드 {attempts, lockoutUntil}
 * lockoutUntil 이 0 이면 잠금 없음
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VerificationLockoutDocument {

    private int attempts;
    private long lockoutUntil;
}
