package com.tickdata.service;

import com.tickdata.domain.model.Bar;
import com.tickdata.domain.model.DateRange;
import com.tickdata.domain.model.ResampledSnapshot;
import com.tickdata.domain.model.Tick;
import com.tickdata.repository.TickStore;
import com.tickdata.timeseries.BarBuilder;
import com.tickdata.timeseries.TickResampler;
import com.tickdata.timeseries.TimeBucketer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Serves resampled ticks and OHLCV bars for a date range, computed on request from stored ticks.
 *
 * <p>Nothing is cached: every call fetches the ticks of the requested range and aggregates them.
 * The frequency is validated before the store is touched. An empty symbol selects every
 * instrument; an empty result is a normal outcome, not an error.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final TickStore tickStore;
    private final TickResampler tickResampler;
    private final BarBuilder barBuilder;

    public MarketDataService(TickStore tickStore, TickResampler tickResampler, BarBuilder barBuilder) {
        this.tickStore = tickStore;
        this.tickResampler = tickResampler;
        this.barBuilder = barBuilder;
    }

    /**
     * Resampled tick snapshots ordered by (instrument, interval).
     *
     * @param symbol           instrument id, or null/blank for all instruments
     * @param dateRange        range of trade dates, inclusive
     * @param frequencySeconds bucket width in seconds
     */
    public List<ResampledSnapshot> getSnapshots(String symbol, DateRange dateRange, long frequencySeconds) {
        TimeBucketer.requireValidFrequency(frequencySeconds);
        List<Tick> ticks = tickStore.fetchTicksInRange(dateRange, symbol);
        List<ResampledSnapshot> snapshots = tickResampler.resample(ticks, frequencySeconds);
        log.info(
                "Snapshots: symbol={}, range={}..{}, frequency={}s, ticks={}, rows={}",
                displaySymbol(symbol),
                dateRange.start(),
                dateRange.end(),
                frequencySeconds,
                ticks.size(),
                snapshots.size());
        return snapshots;
    }

    /**
     * OHLCV bars grouped by instrument, ascending by interval within each instrument.
     *
     * @param symbol           instrument id, or null/blank for all instruments
     * @param dateRange        range of trade dates, inclusive
     * @param frequencySeconds bucket width in seconds
     */
    public List<Bar> getBars(String symbol, DateRange dateRange, long frequencySeconds) {
        TimeBucketer.requireValidFrequency(frequencySeconds);
        List<Tick> ticks = tickStore.fetchTicksInRange(dateRange, symbol);
        List<Bar> bars = barBuilder.buildBars(ticks, frequencySeconds);
        log.info(
                "Bars: symbol={}, range={}..{}, frequency={}s, ticks={}, rows={}",
                displaySymbol(symbol),
                dateRange.start(),
                dateRange.end(),
                frequencySeconds,
                ticks.size(),
                bars.size());
        return bars;
    }

    private static String displaySymbol(String symbol) {
        return symbol == null || symbol.isBlank() ? "*" : symbol;
    }
}
