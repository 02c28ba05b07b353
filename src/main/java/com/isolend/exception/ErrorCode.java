package com.isolend.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Failure category and the HTTP status it maps to. The wire code is the constant's name. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST(400),
    UNAUTHORIZED(403),
    NOT_FOUND(404),
    GOVERNANCE_TIMING(409),
    PROTOCOL_STATE(409),
    INSUFFICIENT_FUNDS(409),
    BOUNDS_VIOLATION(422),
    HEALTH_VIOLATION(422),
    DEGENERATE_ARITHMETIC(422),
    VALUATION_ERROR(424),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    public String getCode() {
        return name();
    }
}
