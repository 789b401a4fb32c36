package com.tickdata.exception;

import java.time.LocalDate;
import java.util.Map;

/**
 * The reference (bhavcopy) or computed (tick store) dataset for a reconciliation could not be
 * obtained. Surfaced to the caller so that a missing source is never reported as "no mismatches".
 */
public class ReconciliationSourceUnavailableException extends BaseException {

    public ReconciliationSourceUnavailableException(String source, LocalDate tradeDate, String message) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message, Map.of("source", source, "tradeDate", tradeDate.toString()));
    }

    public ReconciliationSourceUnavailableException(
            String source, LocalDate tradeDate, String message, Throwable cause) {
        super(
                ErrorCode.SOURCE_UNAVAILABLE,
                message,
                Map.of("source", source, "tradeDate", tradeDate.toString()),
                cause);
    }
}
