package com.isolend.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A two-step governance update was accepted or rejected out of order with its timelock.
 */
@Getter
public class GovernanceException extends BaseException {

    public enum Reason {
        NO_PENDING_UPDATE,
        TIMELOCK_NOT_ELAPSED,
        TIMELOCK_EXPIRED
    }

    private final Reason reason;

    public GovernanceException(Reason reason, String message) {
        super(ErrorCode.GOVERNANCE_TIMING, reason, message, Map.of());
        this.reason = reason;
    }

    public GovernanceException(Reason reason, String message, Map<String, Object> details) {
        super(ErrorCode.GOVERNANCE_TIMING, reason, message, details);
        this.reason = reason;
    }
}
