package com.tickdata.exception;

public class InvalidDateRangeException extends BaseException {

    public InvalidDateRangeException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }

    public InvalidDateRangeException(String message, Throwable cause) {
        super(ErrorCode.BAD_REQUEST, message, cause);
    }
}
