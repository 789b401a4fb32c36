package com.tickdata.ingestion;

import com.tickdata.exception.TickStoreException;
import com.tickdata.repository.TickStore;
import java.io.IOException;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Loads one trade date's tick archive into the tick store.
 *
 * <p>Each ticker file is inserted as its own batch. A batch the store rejects is logged and
 * counted, and ingestion carries on with the next file, so one bad file does not lose the day.
 */
@Service
public class TickIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TickIngestionService.class);

    private final TickArchiveReader tickArchiveReader;
    private final TickStore tickStore;

    public TickIngestionService(TickArchiveReader tickArchiveReader, TickStore tickStore) {
        this.tickArchiveReader = tickArchiveReader;
        this.tickStore = tickStore;
    }

    /**
     * Ingests the archive of {@code tradeDate}.
     *
     * @throws IOException if the archive exists but cannot be read
     */
    public IngestionSummary ingest(LocalDate tradeDate) throws IOException {
        long startTime = System.currentTimeMillis();
        tickStore.ensureSchema();

        AtomicInteger inserted = new AtomicInteger();
        AtomicInteger failedBatches = new AtomicInteger();

        TickArchiveReader.ArchiveReadResult readResult = tickArchiveReader.read(tradeDate, batch -> {
            try {
                tickStore.insertTicks(batch);
                inserted.addAndGet(batch.size());
            } catch (TickStoreException e) {
                failedBatches.incrementAndGet();
                log.error(
                        "Failed to insert {} ticks for {}: {}",
                        batch.size(),
                        batch.get(0).getInstrumentId(),
                        e.getMessage(),
                        e);
            }
        });

        IngestionSummary summary = new IngestionSummary(
                tradeDate,
                readResult.files(),
                inserted.get(),
                readResult.rejectedRows(),
                failedBatches.get(),
                System.currentTimeMillis() - startTime);

        if (summary.failedBatches() > 0) {
            log.warn("Tick ingestion for {} completed with failures: {}", tradeDate, summary);
        } else {
            log.info("Tick ingestion for {} complete: {}", tradeDate, summary);
        }
        return summary;
    }

    /**
     * Outcome of one ingestion run.
     */
    public record IngestionSummary(
            LocalDate tradeDate, int files, int insertedTicks, int rejectedRows, int failedBatches, long durationMs) {}
}
