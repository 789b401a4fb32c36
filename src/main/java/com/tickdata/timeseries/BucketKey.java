package com.tickdata.timeseries;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Identity of one aggregation bucket: (instrument, interval start).
 */
public record BucketKey(String instrumentId, LocalDateTime intervalStart) {

    /** Output order of snapshots: instrument first, then time. */
    public static final Comparator<BucketKey> BY_INSTRUMENT_THEN_TIME =
            Comparator.comparing(BucketKey::instrumentId).thenComparing(BucketKey::intervalStart);

    /** Output order of mismatch tables: time first, then instrument. */
    public static final Comparator<BucketKey> BY_TIME_THEN_INSTRUMENT =
            Comparator.comparing(BucketKey::intervalStart).thenComparing(BucketKey::instrumentId);
}
