package com.tickdata.timeseries;

import com.tickdata.domain.model.Tick;
import com.tickdata.exception.MalformedTickException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Malformed-tick handling shared by {@link TickResampler} and {@link BarBuilder}.
 *
 * <p>A tick without a timestamp or instrument id cannot be placed in any bucket and is removed
 * individually. What a tick without a last price or last quantity does to its bucket depends on
 * the aggregate: bars lose their OHLC and volume and drop the whole bucket, snapshots only need
 * the last tick to be complete. Under the STRICT policy every such tick throws
 * {@link MalformedTickException} instead.
 */
public abstract class AbstractTickAggregator {

    private static final Logger log = LoggerFactory.getLogger(AbstractTickAggregator.class);

    protected final AggregationConfig aggregationConfig;

    protected AbstractTickAggregator(AggregationConfig aggregationConfig) {
        this.aggregationConfig = aggregationConfig;
    }

    /**
     * Returns the ticks that can be assigned to a bucket, dropping (or rejecting) the rest.
     */
    protected List<Tick> bucketable(Collection<Tick> ticks) {
        List<Tick> usable = new ArrayList<>(ticks.size());
        int dropped = 0;
        for (Tick tick : ticks) {
            if (tick == null) {
                dropped++;
                continue;
            }
            String reason = tick.getTimestamp() == null
                    ? "missing timestamp"
                    : tick.getInstrumentId() == null || tick.getInstrumentId().isBlank() ? "missing instrument id" : null;
            if (reason != null) {
                rejectIfStrict(tick, reason);
                dropped++;
                continue;
            }
            usable.add(tick);
        }
        if (dropped > 0) {
            log.warn("Dropped {} of {} ticks that cannot be bucketed", dropped, ticks.size());
        }
        return usable;
    }

    /**
     * Finds the first tick of a bucket whose price or quantity is missing, applying the policy to it.
     *
     * @return true if the bucket is poisoned and must not be emitted
     */
    protected boolean isPoisoned(BucketKey key, List<Tick> bucket) {
        Optional<Tick> malformed = bucket.stream()
                .filter(tick -> missingTradeField(tick) != null)
                .findFirst();
        if (malformed.isEmpty()) {
            return false;
        }
        Tick tick = malformed.get();
        rejectIfStrict(tick, missingTradeField(tick));
        log.debug("Dropping bucket {} @ {}: {}", key.instrumentId(), key.intervalStart(), missingTradeField(tick));
        return true;
    }

    /**
     * Under the STRICT policy, fails on the first tick of the bucket missing a price or quantity.
     */
    protected void rejectMissingTradeFieldsIfStrict(List<Tick> bucket) {
        if (!aggregationConfig.isStrict()) {
            return;
        }
        for (Tick tick : bucket) {
            String reason = missingTradeField(tick);
            if (reason != null) {
                rejectIfStrict(tick, reason);
            }
        }
    }

    private void rejectIfStrict(Tick tick, String reason) {
        if (aggregationConfig.isStrict()) {
            throw new MalformedTickException(tick.getInstrumentId(), tick.getTimestamp(), reason);
        }
    }

    private static String missingTradeField(Tick tick) {
        if (tick.getLastPrice() == null) {
            return "missing last price";
        }
        if (tick.getLastQty() == null) {
            return "missing last quantity";
        }
        return null;
    }
}
