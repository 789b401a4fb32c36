package com.tickdata.timeseries;

import com.tickdata.exception.InvalidFrequencyException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Maps timestamps onto fixed-width interval boundaries.
 *
 * <p>All buckets are aligned to the same epoch (1970-01-01T00:00, exchange-local time), so buckets
 * of different instruments line up with each other and any frequency that divides a day evenly
 * starts its buckets at midnight. A frequency of 86400 yields exactly one bucket per calendar day.
 */
public final class TimeBucketer {

    public static final long SECONDS_PER_DAY = 86_400L;

    /** Widest bucket accepted: ten 365-day years. Keeps bucket arithmetic inside the LocalDateTime range. */
    public static final long MAX_FREQUENCY_SECONDS = 3_650L * SECONDS_PER_DAY;

    private TimeBucketer() {}

    /**
     * Returns the start of the bucket containing {@code timestamp}:
     * {@code start <= timestamp < start + frequencySeconds}.
     *
     * @throws InvalidFrequencyException if {@code frequencySeconds} is not in [1, MAX_FREQUENCY_SECONDS]
     */
    public static LocalDateTime bucketStart(LocalDateTime timestamp, long frequencySeconds) {
        requireValidFrequency(frequencySeconds);
        // toEpochSecond drops the sub-second part, which is already a floor
        long epochSecond = timestamp.toEpochSecond(ZoneOffset.UTC);
        long start = Math.floorDiv(epochSecond, frequencySeconds) * frequencySeconds;
        return LocalDateTime.ofEpochSecond(start, 0, ZoneOffset.UTC);
    }

    /**
     * Rejects non-positive frequencies and frequencies above {@link #MAX_FREQUENCY_SECONDS}.
     * Called before any data is fetched or aggregated.
     */
    public static void requireValidFrequency(long frequencySeconds) {
        if (frequencySeconds <= 0 || frequencySeconds > MAX_FREQUENCY_SECONDS) {
            throw new InvalidFrequencyException(frequencySeconds, MAX_FREQUENCY_SECONDS);
        }
    }
}
