package com.tickdata.unit.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tickdata.domain.model.Tick;
import com.tickdata.exception.TickStoreException;
import com.tickdata.ingestion.TickArchiveReader;
import com.tickdata.ingestion.TickArchiveReader.ArchiveReadResult;
import com.tickdata.ingestion.TickIngestionService;
import com.tickdata.ingestion.TickIngestionService.IngestionSummary;
import com.tickdata.repository.InMemoryTickStore;
import com.tickdata.repository.TickStore;
import java.io.IOException;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TickIngestionServiceTest {

    private static final LocalDate TRADE_DATE = LocalDate.of(2022, 4, 4);

    @Mock
    private TickArchiveReader tickArchiveReader;

    @Test
    @DisplayName("ensures the schema, then stores every batch the archive yields")
    void ingestsBatches() throws IOException {
        InMemoryTickStore tickStore = new InMemoryTickStore();
        List<Tick> tcs = List.of(tick("TCS", 0), tick("TCS", 1));
        List<Tick> infy = List.of(tick("INFY", 0));
        stubArchive(new ArchiveReadResult(2, 3, 4), tcs, infy);

        IngestionSummary summary = new TickIngestionService(tickArchiveReader, tickStore).ingest(TRADE_DATE);

        assertThat(summary.tradeDate()).isEqualTo(TRADE_DATE);
        assertThat(summary.files()).isEqualTo(2);
        assertThat(summary.insertedTicks()).isEqualTo(3);
        assertThat(summary.rejectedRows()).isEqualTo(4);
        assertThat(summary.failedBatches()).isZero();
        assertThat(tickStore.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("a batch the store rejects is counted and ingestion carries on")
    void continuesAfterFailedBatch() throws IOException {
        TickStore tickStore = mock(TickStore.class);
        List<Tick> tcs = List.of(tick("TCS", 0));
        List<Tick> infy = List.of(tick("INFY", 0), tick("INFY", 1));
        doThrow(new TickStoreException("insert failed", new SQLException("duplicate")))
                .doNothing()
                .when(tickStore)
                .insertTicks(anyList());
        stubArchive(new ArchiveReadResult(2, 3, 0), tcs, infy);

        IngestionSummary summary = new TickIngestionService(tickArchiveReader, tickStore).ingest(TRADE_DATE);

        assertThat(summary.failedBatches()).isEqualTo(1);
        assertThat(summary.insertedTicks()).isEqualTo(2);
        InOrder order = inOrder(tickStore);
        order.verify(tickStore).ensureSchema();
        order.verify(tickStore, times(2)).insertTicks(anyList());
    }

    @Test
    @DisplayName("a missing archive ingests nothing")
    void missingArchive() throws IOException {
        TickStore tickStore = mock(TickStore.class);
        when(tickArchiveReader.read(eq(TRADE_DATE), any())).thenReturn(new ArchiveReadResult(0, 0, 0));

        IngestionSummary summary = new TickIngestionService(tickArchiveReader, tickStore).ingest(TRADE_DATE);

        assertThat(summary.insertedTicks()).isZero();
        verify(tickStore).ensureSchema();
        verify(tickStore, times(0)).insertTicks(anyList());
    }

    @SafeVarargs
    private void stubArchive(ArchiveReadResult result, List<Tick>... batches) throws IOException {
        doAnswer(invocation -> {
                    Consumer<List<Tick>> consumer = invocation.getArgument(1);
                    for (List<Tick> batch : batches) {
                        consumer.accept(batch);
                    }
                    return result;
                })
                .when(tickArchiveReader)
                .read(eq(TRADE_DATE), any());
    }

    private static Tick tick(String instrument, int second) {
        return Tick.builder()
                .timestamp(LocalDateTime.of(2022, 4, 4, 9, 15, second))
                .instrumentId(instrument)
                .lastPrice(BigDecimal.TEN)
                .lastQty(1L)
                .build();
    }
}
