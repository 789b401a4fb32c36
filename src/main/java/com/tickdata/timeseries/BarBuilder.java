package com.tickdata.timeseries;

import com.tickdata.domain.model.Bar;
import com.tickdata.domain.model.Tick;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds OHLCV bars from ticks, one bar per (instrument, interval) bucket.
 *
 * <p>Ticks are grouped by instrument first (groups in first-seen order), then each instrument is
 * stably sorted by timestamp and bucketed on its own. Within a bucket: open = price of the
 * earliest tick, close = price of the latest, high/low = price extrema, volume = summed quantity.
 * Empty buckets are omitted. Buckets containing a tick without price or quantity are dropped,
 * or fail the call under the STRICT policy.
 */
@Component
public class BarBuilder extends AbstractTickAggregator {

    private static final Logger log = LoggerFactory.getLogger(BarBuilder.class);

    public BarBuilder(AggregationConfig aggregationConfig) {
        super(aggregationConfig);
    }

    /**
     * Aggregates ticks into bars.
     *
     * @param ticks            ticks of one or more instruments, in any order
     * @param frequencySeconds bucket width in seconds, must be positive
     * @return bars grouped by instrument (first-seen order), ascending by interval within a group
     */
    public List<Bar> buildBars(Collection<Tick> ticks, long frequencySeconds) {
        TimeBucketer.requireValidFrequency(frequencySeconds);

        Map<String, List<Tick>> byInstrument = TickGrouping.groupBy(bucketable(ticks), Tick::getInstrumentId);

        List<Bar> bars = new ArrayList<>();
        int dropped = 0;
        for (Map.Entry<String, List<Tick>> instrument : byInstrument.entrySet()) {
            List<Tick> sorted = TickGrouping.stableSort(instrument.getValue(), TickGrouping.BY_TIME);
            Map<LocalDateTime, List<Tick>> buckets = TickGrouping.groupBy(
                    sorted, tick -> TimeBucketer.bucketStart(tick.getTimestamp(), frequencySeconds));

            for (Map.Entry<LocalDateTime, List<Tick>> bucket : buckets.entrySet()) {
                BucketKey key = new BucketKey(instrument.getKey(), bucket.getKey());
                if (isPoisoned(key, bucket.getValue())) {
                    dropped++;
                    continue;
                }
                PendingBar pendingBar = new PendingBar(key.instrumentId(), key.intervalStart());
                bucket.getValue().forEach(pendingBar::update);
                bars.add(pendingBar.toBar());
            }
        }

        log.debug(
                "Built {} bars for {} instruments (frequency={}s, dropped buckets={})",
                bars.size(),
                byInstrument.size(),
                frequencySeconds,
                dropped);
        return bars;
    }

    /**
     * Rolls bars up into buckets of {@code frequencySeconds}.
     *
     * <p>Bars already aligned to that frequency come back unchanged, so rolling up is idempotent.
     * Rolling up to a finer frequency than the input's keeps each bar in its own (finer) bucket
     * without splitting it.
     *
     * @return bars grouped by instrument (first-seen order), ascending by interval within a group
     */
    public List<Bar> resampleBars(Collection<Bar> bars, long frequencySeconds) {
        TimeBucketer.requireValidFrequency(frequencySeconds);

        Map<String, List<Bar>> byInstrument = new LinkedHashMap<>();
        for (Bar bar : bars) {
            byInstrument.computeIfAbsent(bar.getInstrumentId(), id -> new ArrayList<>()).add(bar);
        }

        List<Bar> result = new ArrayList<>();
        for (Map.Entry<String, List<Bar>> instrument : byInstrument.entrySet()) {
            List<Bar> sorted = new ArrayList<>(instrument.getValue());
            sorted.sort(Comparator.comparing(Bar::getIntervalStart));

            Map<LocalDateTime, PendingBar> buckets = new LinkedHashMap<>();
            for (Bar bar : sorted) {
                LocalDateTime start = TimeBucketer.bucketStart(bar.getIntervalStart(), frequencySeconds);
                buckets.computeIfAbsent(start, s -> new PendingBar(instrument.getKey(), s))
                        .update(bar);
            }
            buckets.values().stream().map(PendingBar::toBar).forEach(result::add);
        }
        return result;
    }
}
