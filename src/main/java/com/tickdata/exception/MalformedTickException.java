package com.tickdata.exception;

import java.util.Map;

/**
 * A tick lacks a field the aggregation needs. Only raised under the STRICT malformed-tick policy;
 * the default policy drops the offending row instead.
 */
public class MalformedTickException extends BaseException {

    public MalformedTickException(String instrumentId, Object timestamp, String reason) {
        super(
                ErrorCode.MALFORMED_DATA,
                String.format("Malformed tick for %s at %s: %s", instrumentId, timestamp, reason),
                details(instrumentId, timestamp, reason));
    }

    private static Map<String, Object> details(String instrumentId, Object timestamp, String reason) {
        return Map.of(
                "instrumentId", String.valueOf(instrumentId),
                "timestamp", String.valueOf(timestamp),
                "reason", reason);
    }
}
