package com.tickdata.exception;

import java.util.Map;

/**
 * Thrown before any aggregation starts when the bucket width is not a positive number of seconds
 * or exceeds the largest supported bucket.
 */
public class InvalidFrequencyException extends BaseException {

    public InvalidFrequencyException(long frequencySeconds, long maxFrequencySeconds) {
        super(
                ErrorCode.INVALID_FREQUENCY,
                String.format(
                        "Frequency must be between 1 and %d seconds, got %d", maxFrequencySeconds, frequencySeconds),
                Map.of("frequency", frequencySeconds, "maxFrequency", maxFrequencySeconds));
    }
}
