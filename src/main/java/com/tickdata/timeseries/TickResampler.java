package com.tickdata.timeseries;

import com.tickdata.domain.model.ResampledSnapshot;
import com.tickdata.domain.model.Tick;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts an irregular tick stream into one snapshot per (instrument, interval) bucket.
 *
 * <p>Per bucket: last price, quote side and open interest come from the temporally last tick,
 * traded quantity is the sum of the quantities present. Input is stably re-sorted by
 * (instrument, timestamp) first, so arrival order only matters for ticks sharing a timestamp.
 * The output is sparse: empty buckets are never materialized. A snapshot is dropped only when
 * its own fields are incomplete, i.e. the last tick lacks a price, a quote-side value or open
 * interest; an earlier malformed tick does not affect it.
 */
@Component
public class TickResampler extends AbstractTickAggregator {

    private static final Logger log = LoggerFactory.getLogger(TickResampler.class);

    public TickResampler(AggregationConfig aggregationConfig) {
        super(aggregationConfig);
    }

    /**
     * Resamples ticks into snapshots ordered by (instrumentId, intervalStart).
     *
     * @param ticks            ticks of one or more instruments, in any order
     * @param frequencySeconds bucket width in seconds, must be positive
     * @return snapshots for the non-empty, complete buckets; empty if there are no usable ticks
     */
    public List<ResampledSnapshot> resample(Collection<Tick> ticks, long frequencySeconds) {
        TimeBucketer.requireValidFrequency(frequencySeconds);

        List<Tick> sorted = TickGrouping.stableSort(bucketable(ticks), TickGrouping.BY_INSTRUMENT_THEN_TIME);
        // Sorted input makes first-seen key order equal to (instrument, interval) order
        Map<BucketKey, List<Tick>> buckets = TickGrouping.groupBy(
                sorted,
                tick -> new BucketKey(
                        tick.getInstrumentId(), TimeBucketer.bucketStart(tick.getTimestamp(), frequencySeconds)));

        List<ResampledSnapshot> snapshots = new ArrayList<>(buckets.size());
        int dropped = 0;
        for (Map.Entry<BucketKey, List<Tick>> bucket : buckets.entrySet()) {
            rejectMissingTradeFieldsIfStrict(bucket.getValue());
            Tick last = bucket.getValue().get(bucket.getValue().size() - 1);
            if (!isComplete(last)) {
                dropped++;
                continue;
            }
            snapshots.add(toSnapshot(bucket.getKey(), bucket.getValue(), last));
        }

        log.debug(
                "Resampled {} ticks into {} snapshots (frequency={}s, dropped={})",
                sorted.size(),
                snapshots.size(),
                frequencySeconds,
                dropped);
        return snapshots;
    }

    private static boolean isComplete(Tick tick) {
        return tick.getLastPrice() != null
                && tick.getBuyPrice() != null
                && tick.getBuyQty() != null
                && tick.getSellPrice() != null
                && tick.getSellQty() != null
                && tick.getOpenInterest() != null;
    }

    private static ResampledSnapshot toSnapshot(BucketKey key, List<Tick> bucket, Tick last) {
        long lastQtyTotal = 0;
        for (Tick tick : bucket) {
            if (tick.getLastQty() != null) {
                lastQtyTotal += tick.getLastQty();
            }
        }
        return ResampledSnapshot.builder()
                .instrumentId(key.instrumentId())
                .intervalStart(key.intervalStart())
                .lastPrice(last.getLastPrice().doubleValue())
                .lastQtyTotal(lastQtyTotal)
                .buyPrice(last.getBuyPrice().doubleValue())
                .buyQty(last.getBuyQty())
                .sellPrice(last.getSellPrice().doubleValue())
                .sellQty(last.getSellQty())
                .openInterest(last.getOpenInterest())
                .build();
    }
}
