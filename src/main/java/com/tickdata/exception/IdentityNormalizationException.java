package com.tickdata.exception;

/**
 * A reference row's (symbol, series) pair cannot be turned into an instrument id.
 * The reconciler recovers from it by excluding the row from the join and counting it.
 */
public class IdentityNormalizationException extends BaseException {

    public IdentityNormalizationException(String symbol, String series, String reason) {
        super(
                ErrorCode.MALFORMED_DATA,
                String.format("Cannot derive instrument id from symbol=%s, series=%s: %s", symbol, series, reason));
    }
}
