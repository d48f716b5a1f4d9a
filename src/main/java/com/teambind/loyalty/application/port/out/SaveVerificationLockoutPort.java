package com.teambind.loyalty.application.port.out;

import com.teambind.loyalty.domain.model.VerificationLockout;

public interface SaveVerificationLockoutPort {

    boolean save(VerificationLockout lockout);
}
