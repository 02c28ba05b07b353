package com.isolend.api.dto.response;

import com.isolend.exception.BaseException;
import com.isolend.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Value;

/**
 * Failure envelope. {@code error.reason} names the protocol failure (e.g.
 * {@code TIMELOCK_NOT_ELAPSED}) so clients can branch on it without parsing the message; for
 * failures outside the protocol it repeats the error code.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    Failure error;

    public static ApiErrorResponse from(BaseException ex, String path) {
        return new ApiErrorResponse(new Failure(
                ex.getErrorCode().getCode(), ex.getReasonCode(), ex.getMessage(), ex.getDetails(), path, Instant.now()));
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, String path) {
        return new ApiErrorResponse(new Failure(
                errorCode.getCode(), errorCode.getCode(), message, Map.of(), path, Instant.now()));
    }

    public record Failure(
            String code, String reason, String message, Map<String, Object> details, String path, Instant timestamp) {}
}
