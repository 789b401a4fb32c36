package com.tickdata.exception;

/**
 * A tick store backend failed to read, write or create its schema.
 */
public class TickStoreException extends BaseException {

    public TickStoreException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
