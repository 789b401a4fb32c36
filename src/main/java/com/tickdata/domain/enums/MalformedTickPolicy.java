package com.tickdata.domain.enums;

/**
 * What the aggregators do with ticks whose required fields are missing.
 *
 * <p>DROP_ROW = skip the tick (or the bucket it poisons) and keep going.
 * STRICT = fail the whole request with a MalformedTickException.
 */
public enum MalformedTickPolicy {
    DROP_ROW,
    STRICT
}
