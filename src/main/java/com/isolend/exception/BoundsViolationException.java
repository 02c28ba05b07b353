package com.isolend.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A configured limit or capacity would be exceeded by the call.
 */
@Getter
public class BoundsViolationException extends BaseException {

    public enum Reason {
        LTV_OUT_OF_BOUNDS,
        DEPOSIT_CAP_EXCEEDED,
        BORROW_CAP_EXCEEDED,
        POOL_CAP_EXCEEDED,
        SUPERPOOL_CAP_EXCEEDED,
        MAX_ASSETS_EXCEEDED,
        MAX_DEBT_POOLS_EXCEEDED,
        MAX_QUEUE_LENGTH_EXCEEDED,
        FEE_TOO_HIGH,
        BORROW_BELOW_MINIMUM,
        DEBT_BELOW_MINIMUM,
        INVALID_PARAMETER
    }

    private final Reason reason;

    public BoundsViolationException(Reason reason, String message) {
        super(ErrorCode.BOUNDS_VIOLATION, reason, message, Map.of());
        this.reason = reason;
    }

    public BoundsViolationException(Reason reason, String message, Map<String, Object> details) {
        super(ErrorCode.BOUNDS_VIOLATION, reason, message, details);
        this.reason = reason;
    }
}
