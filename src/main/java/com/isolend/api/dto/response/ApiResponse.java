package com.isolend.api.dto.response;

import java.time.Instant;
import lombok.Value;

/** Success envelope: {@code {"success": true, "data": ..., "timestamp": ...}}. */
@Value
public class ApiResponse<T> {

    boolean success = true;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, Instant.now());
    }
}
