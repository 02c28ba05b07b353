package com.isolend.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A position health or liquidation-legality check failed.
 */
@Getter
public class HealthViolationException extends BaseException {

    public enum Reason {
        HEALTH_CHECK_FAILED,
        LIQUIDATE_HEALTHY_POSITION,
        CLOSE_FACTOR_EXCEEDED,
        SEIZED_TOO_MUCH_COLLATERAL,
        NO_BAD_DEBT,
        LIQUIDATION_WORSENED_HEALTH
    }

    private final Reason reason;

    public HealthViolationException(Reason reason, String message) {
        super(ErrorCode.HEALTH_VIOLATION, reason, message, Map.of());
        this.reason = reason;
    }

    public HealthViolationException(Reason reason, String message, Map<String, Object> details) {
        super(ErrorCode.HEALTH_VIOLATION, reason, message, details);
        this.reason = reason;
    }
}
