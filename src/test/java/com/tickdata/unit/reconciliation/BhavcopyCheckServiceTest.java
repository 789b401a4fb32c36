package com.tickdata.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tickdata.domain.model.Bar;
import com.tickdata.domain.model.DateRange;
import com.tickdata.domain.model.MismatchReport;
import com.tickdata.domain.model.ReferenceBar;
import com.tickdata.event.ReconciliationEvent;
import com.tickdata.exception.ReconciliationSourceUnavailableException;
import com.tickdata.exception.TickStoreException;
import com.tickdata.ingestion.BhavcopyArchiveReader;
import com.tickdata.reconciliation.BhavcopyCheckService;
import com.tickdata.reconciliation.Reconciler;
import com.tickdata.service.MarketDataService;
import com.tickdata.timeseries.AggregationConfig;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class BhavcopyCheckServiceTest {

    private static final LocalDate TRADE_DATE = LocalDate.of(2022, 4, 4);

    @Mock
    private BhavcopyArchiveReader bhavcopyArchiveReader;

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private BhavcopyCheckService bhavcopyCheckService;

    @BeforeEach
    void setUp() {
        bhavcopyCheckService = new BhavcopyCheckService(
                bhavcopyArchiveReader,
                marketDataService,
                new Reconciler(),
                new AggregationConfig(),
                applicationEventPublisher);
    }

    @Test
    @DisplayName("compares bhavcopy rows with daily bars of the same date and publishes the result")
    void runsChecks() {
        when(bhavcopyArchiveReader.read(TRADE_DATE))
                .thenReturn(List.of(ReferenceBar.builder()
                        .symbol("TCS")
                        .series("EQ")
                        .tradeDate(TRADE_DATE)
                        .open(3500.0)
                        .high(3550.0)
                        .low(3480.0)
                        .close(3520.0)
                        .volume(1_000L)
                        .build()));
        when(marketDataService.getBars(isNull(), eq(DateRange.of(TRADE_DATE)), eq(86_400L)))
                .thenReturn(List.of(Bar.builder()
                        .instrumentId("TCS")
                        .intervalStart(TRADE_DATE.atStartOfDay())
                        .open(3500)
                        .high(3560)
                        .low(3480)
                        .close(3520)
                        .volume(900)
                        .build()));

        MismatchReport report = bhavcopyCheckService.runChecks(TRADE_DATE);

        assertThat(report.getVolumeMismatch().size()).isEqualTo(1);
        assertThat(report.getHighMismatch().size()).isEqualTo(1);
        assertThat(report.getLowMismatch()).isNull();

        ArgumentCaptor<ReconciliationEvent> captor = ArgumentCaptor.forClass(ReconciliationEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getTradeDate()).isEqualTo(TRADE_DATE);
        assertThat(captor.getValue().getReport()).isSameAs(report);
    }

    @Test
    @DisplayName("a missing bhavcopy is surfaced, never reported as a clean day")
    void missingReference() {
        when(bhavcopyArchiveReader.read(TRADE_DATE))
                .thenThrow(new ReconciliationSourceUnavailableException("bhavcopy", TRADE_DATE, "not found"));

        assertThatThrownBy(() -> bhavcopyCheckService.runChecks(TRADE_DATE))
                .isInstanceOf(ReconciliationSourceUnavailableException.class);

        verifyNoInteractions(marketDataService, applicationEventPublisher);
    }

    @Test
    @DisplayName("a failing tick store becomes a source-unavailable failure")
    void computedSourceUnavailable() {
        when(bhavcopyArchiveReader.read(TRADE_DATE)).thenReturn(List.of());
        when(marketDataService.getBars(isNull(), any(DateRange.class), eq(86_400L)))
                .thenThrow(new TickStoreException("query failed", new SQLException("connection refused")));

        assertThatThrownBy(() -> bhavcopyCheckService.runChecks(TRADE_DATE))
                .isInstanceOf(ReconciliationSourceUnavailableException.class)
                .hasMessageContaining("query failed")
                .satisfies(e -> assertThat(((ReconciliationSourceUnavailableException) e).getDetails())
                        .containsEntry("source", "tick-store"));
    }
}
