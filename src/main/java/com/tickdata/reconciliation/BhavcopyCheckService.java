package com.tickdata.reconciliation;

import com.tickdata.domain.model.Bar;
import com.tickdata.domain.model.DateRange;
import com.tickdata.domain.model.MismatchReport;
import com.tickdata.domain.model.ReferenceBar;
import com.tickdata.event.ReconciliationEvent;
import com.tickdata.exception.ReconciliationSourceUnavailableException;
import com.tickdata.exception.TickStoreException;
import com.tickdata.ingestion.BhavcopyArchiveReader;
import com.tickdata.service.MarketDataService;
import com.tickdata.timeseries.AggregationConfig;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Data-quality check of one trade date: bhavcopy vs. daily bars built from stored ticks.
 *
 * <p>Both datasets must be obtainable. A missing bhavcopy archive or a failing tick store raises
 * {@link ReconciliationSourceUnavailableException}; it is never turned into an empty report.
 * Every completed run publishes a {@link ReconciliationEvent}.
 */
@Service
public class BhavcopyCheckService {

    private static final Logger log = LoggerFactory.getLogger(BhavcopyCheckService.class);

    private static final String COMPUTED_SOURCE = "tick-store";

    private final BhavcopyArchiveReader bhavcopyArchiveReader;
    private final MarketDataService marketDataService;
    private final Reconciler reconciler;
    private final AggregationConfig aggregationConfig;
    private final ApplicationEventPublisher applicationEventPublisher;

    public BhavcopyCheckService(
            BhavcopyArchiveReader bhavcopyArchiveReader,
            MarketDataService marketDataService,
            Reconciler reconciler,
            AggregationConfig aggregationConfig,
            ApplicationEventPublisher applicationEventPublisher) {
        this.bhavcopyArchiveReader = bhavcopyArchiveReader;
        this.marketDataService = marketDataService;
        this.reconciler = reconciler;
        this.aggregationConfig = aggregationConfig;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Runs all bhavcopy checks for {@code tradeDate}.
     *
     * @throws ReconciliationSourceUnavailableException if either dataset cannot be obtained
     */
    public MismatchReport runChecks(LocalDate tradeDate) {
        long startTime = System.currentTimeMillis();
        log.info("Bhavcopy check started: tradeDate={}", tradeDate);

        List<ReferenceBar> referenceRows = bhavcopyArchiveReader.read(tradeDate);

        List<Bar> computedRows;
        try {
            computedRows = marketDataService.getBars(
                    null, DateRange.of(tradeDate), aggregationConfig.getEndOfDayFrequencySeconds());
        } catch (TickStoreException e) {
            throw new ReconciliationSourceUnavailableException(
                    COMPUTED_SOURCE, tradeDate, "Computed bars unavailable: " + e.getMessage(), e);
        }

        MismatchReport report = reconciler.reconcile(referenceRows, computedRows);

        applicationEventPublisher.publishEvent(new ReconciliationEvent(this, tradeDate, report));

        long durationMs = System.currentTimeMillis() - startTime;
        if (report.hasMismatches() || report.getRowCountDifference() != 0) {
            log.warn(
                    "Bhavcopy check {}: rowCountDifference={}, mismatches={}, unmapped={}, duration={}ms",
                    tradeDate,
                    report.getRowCountDifference(),
                    report.getTotalMismatches(),
                    report.getUnmappedReferenceRows(),
                    durationMs);
        } else {
            log.info("Bhavcopy check {}: no mismatches, duration={}ms", tradeDate, durationMs);
        }
        return report;
    }
}
