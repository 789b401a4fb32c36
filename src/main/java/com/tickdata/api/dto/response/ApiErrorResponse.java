package com.tickdata.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tickdata.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;

/**
 * Error envelope rendered by the GlobalExceptionHandler:
 * {@code {"success": false, "error": {"code", "status", "message", "details", "path", "timestamp"}}}.
 * Empty details are omitted.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(new ErrorDetail(
                errorCode.getCode(),
                errorCode.getHttpStatus().value(),
                message,
                details != null ? details : Map.of(),
                path,
                Instant.now()));
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ErrorDetail(
            String code, int status, String message, Map<String, Object> details, String path, Instant timestamp) {}
}
