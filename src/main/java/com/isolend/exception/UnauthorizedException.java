package com.isolend.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Caller lacks the authority for the call, or the target is not on an allow-list.
 */
@Getter
public class UnauthorizedException extends BaseException {

    public enum Reason {
        NOT_OWNER_OR_OPERATOR,
        ONLY_POSITION_MANAGER,
        ONLY_POOL_OWNER,
        ONLY_PROTOCOL_OWNER,
        ONLY_ALLOCATOR,
        UNKNOWN_ASSET,
        UNKNOWN_SPENDER,
        UNKNOWN_FUNCTION,
        INVALID_POSITION_ADDRESS,
        INSUFFICIENT_ALLOWANCE
    }

    private final Reason reason;

    public UnauthorizedException(Reason reason, String message) {
        super(ErrorCode.UNAUTHORIZED, reason, message, Map.of());
        this.reason = reason;
    }

    public UnauthorizedException(Reason reason, String message, Map<String, Object> details) {
        super(ErrorCode.UNAUTHORIZED, reason, message, details);
        this.reason = reason;
    }
}
