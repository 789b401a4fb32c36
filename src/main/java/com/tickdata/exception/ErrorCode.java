package com.tickdata.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Machine-readable error codes and the HTTP status each one is answered with.
 * The enum name is the code rendered in {@code error.code}.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    /** Bucket width is not a positive number of seconds, or is wider than the supported maximum. */
    INVALID_FREQUENCY(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** Source rows lack a field needed to aggregate or reconcile them. */
    MALFORMED_DATA(HttpStatus.UNPROCESSABLE_ENTITY),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    /** A reconciliation input (bhavcopy archive or computed bars) could not be obtained. */
    SOURCE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    STORAGE_ERROR(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    public String getCode() {
        return name();
    }

    public boolean isServerError() {
        return httpStatus.is5xxServerError();
    }
}
