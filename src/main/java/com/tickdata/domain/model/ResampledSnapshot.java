package com.tickdata.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Fixed-frequency view of the tick stream: one row per (instrument, interval) bucket.
 *
 * <p>Price and quote fields carry the values of the temporally last tick in the bucket,
 * {@code lastQtyTotal} is the sum over the bucket. Buckets without ticks are not materialized
 * (the output is sparse, never forward-filled).
 */
@Value
@Builder
public class ResampledSnapshot {

    String instrumentId;
    LocalDateTime intervalStart;
    double lastPrice;
    long lastQtyTotal;
    double buyPrice;
    long buyQty;
    double sellPrice;
    long sellQty;
    long openInterest;
}
