package com.isolend.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A price or collateral valuation could not be completed. Never substituted with a default.
 */
@Getter
public class ValuationException extends BaseException {

    public enum Reason {
        NO_ORACLE_FOUND,
        STALE_PRICE,
        UNSUPPORTED_ASSET,
        ZERO_COLLATERAL_WITH_DEBT
    }

    private final Reason reason;

    public ValuationException(Reason reason, String message) {
        super(ErrorCode.VALUATION_ERROR, reason, message, Map.of());
        this.reason = reason;
    }

    public ValuationException(Reason reason, String message, Map<String, Object> details) {
        super(ErrorCode.VALUATION_ERROR, reason, message, details);
        this.reason = reason;
    }
}
