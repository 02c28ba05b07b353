package com.isolend.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A share or asset conversion rounded to zero where a nonzero result is required.
 */
@Getter
public class DegenerateArithmeticException extends BaseException {

    public enum Reason {
        ZERO_SHARES,
        ZERO_ASSETS
    }

    private final Reason reason;

    public DegenerateArithmeticException(Reason reason, String message) {
        super(ErrorCode.DEGENERATE_ARITHMETIC, reason, message, Map.of());
        this.reason = reason;
    }

    public DegenerateArithmeticException(Reason reason, String message, Map<String, Object> details) {
        super(ErrorCode.DEGENERATE_ARITHMETIC, reason, message, details);
        this.reason = reason;
    }
}
