package com.isolend.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of every protocol failure. Subclasses with a {@code Reason} enum record it under the
 * {@code reason} detail key, which the REST layer reports next to the {@link ErrorCode}.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    protected BaseException(ErrorCode errorCode, Enum<?> reason, String message, Map<String, Object> details) {
        this(errorCode, message, withReason(reason, details));
    }

    /** The failure reason, or the error code for exceptions that carry none. */
    public String getReasonCode() {
        Object reason = details.get("reason");
        return reason != null ? reason.toString() : errorCode.getCode();
    }

    private static Map<String, Object> withReason(Enum<?> reason, Map<String, Object> details) {
        Map<String, Object> merged = new LinkedHashMap<>(details != null ? details : Map.of());
        merged.put("reason", reason.name());
        return merged;
    }
}
