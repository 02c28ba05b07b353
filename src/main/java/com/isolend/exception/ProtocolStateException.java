package com.isolend.exception;

import java.util.Map;
import lombok.Getter;

/**
 * The call conflicts with the current lifecycle state of a protocol object.
 */
@Getter
public class ProtocolStateException extends BaseException {

    public enum Reason {
        POOL_ALREADY_INITIALIZED,
        POOL_PAUSED,
        POSITION_ALREADY_EXISTS,
        SUPERPOOL_ALREADY_EXISTS,
        SUPERPOOL_PAUSED,
        POOL_ALREADY_IN_SUPERPOOL,
        POOL_NOT_IN_SUPERPOOL,
        NONZERO_POOL_BALANCE,
        INVALID_QUEUE_REORDER,
        UNKNOWN_RATE_MODEL
    }

    private final Reason reason;

    public ProtocolStateException(Reason reason, String message) {
        super(ErrorCode.PROTOCOL_STATE, reason, message, Map.of());
        this.reason = reason;
    }

    public ProtocolStateException(Reason reason, String message, Map<String, Object> details) {
        super(ErrorCode.PROTOCOL_STATE, reason, message, details);
        this.reason = reason;
    }
}
