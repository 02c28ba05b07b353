package com.isolend.exception;

import java.util.Map;
import lombok.Getter;

/**
 * The caller or a pool does not hold enough to complete the call.
 */
@Getter
public class InsufficientFundsException extends BaseException {

    public enum Reason {
        INSUFFICIENT_BALANCE,
        INSUFFICIENT_LIQUIDITY,
        INSUFFICIENT_WITHDRAW_PATH
    }

    private final Reason reason;

    public InsufficientFundsException(Reason reason, String message) {
        super(ErrorCode.INSUFFICIENT_FUNDS, reason, message, Map.of());
        this.reason = reason;
    }

    public InsufficientFundsException(Reason reason, String message, Map<String, Object> details) {
        super(ErrorCode.INSUFFICIENT_FUNDS, reason, message, details);
        this.reason = reason;
    }
}
