package com.teambind.loyalty.application.port.out;

import com.teambind.loyalty.domain.model.VerificationLockout;

public interface LoadVerificationLockoutPort {

    /**
     * 저장된 잠금 상태, 없거나 읽을 수 없으면 해제 상태
     */
    VerificationLockout load();
}
