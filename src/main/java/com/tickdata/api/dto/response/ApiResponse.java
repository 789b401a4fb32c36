package com.tickdata.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for JSON endpoints, applied by {@link com.tickdata.config.ApiResponseAdvice}:
 * {@code {"success": true, "data": ..., "path": "/api/...", "timestamp": ...}}.
 * CSV streams are written raw and never wrapped.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final String path;
    private final Instant timestamp;

    private ApiResponse(T data, String path) {
        this.data = data;
        this.path = path;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data, String path) {
        return new ApiResponse<>(data, path);
    }
}
