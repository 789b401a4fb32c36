package com.tickdata.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A single OHLCV bar aggregated from the ticks of one instrument in one interval bucket.
 *
 * <p>Bars are computed on request, never persisted. A bucket without ticks never produces a bar,
 * so there are no zero-volume synthetic bars. Open and close are drawn from the same set of
 * prices whose extrema are high and low, so {@code low <= open, close <= high} always holds.
 */
@Value
@Builder
public class Bar {

    String instrumentId;

    /** Start of the bucket, inclusive. */
    LocalDateTime intervalStart;

    /** Last traded price of the earliest tick in the bucket. */
    double open;

    double high;

    double low;

    /** Last traded price of the latest tick in the bucket. */
    double close;

    /** Sum of last traded quantities in the bucket. */
    long volume;
}
