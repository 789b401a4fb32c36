package com.tickdata.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tickdata.api.controller.MarketDataController;
import com.tickdata.config.ApiResponseAdvice;
import com.tickdata.domain.model.DateRange;
import com.tickdata.domain.model.Tick;
import com.tickdata.exception.GlobalExceptionHandler;
import com.tickdata.exception.TickStoreException;
import com.tickdata.repository.TickStore;
import com.tickdata.service.MarketDataService;
import com.tickdata.timeseries.AggregationConfig;
import com.tickdata.timeseries.BarBuilder;
import com.tickdata.timeseries.TickResampler;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Standalone MockMvc tests for the CSV market-data endpoints.
 * CSV bodies are rendered by invoking the controller directly; MockMvc covers routing and errors.
 */
@ExtendWith(MockitoExtension.class)
class MarketDataControllerTest {

    private static final DateRange APRIL_4 = DateRange.of(LocalDate.of(2022, 4, 4));
    private static final LocalDateTime T0915 = LocalDateTime.of(2022, 4, 4, 9, 15);

    @Mock
    private TickStore tickStore;

    private MarketDataController controller;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AggregationConfig aggregationConfig = new AggregationConfig();
        MarketDataService marketDataService = new MarketDataService(
                tickStore, new TickResampler(aggregationConfig), new BarBuilder(aggregationConfig));
        controller = new MarketDataController(marketDataService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Nested
    @DisplayName("GET /api/ohlcv")
    class Ohlcv {

        @Test
        @DisplayName("streams a header row followed by one line per bar")
        void streamsBars() throws IOException {
            when(tickStore.fetchTicksInRange(APRIL_4, "TCS"))
                    .thenReturn(List.of(
                            tick("TCS", T0915, "3500", 10),
                            tick("TCS", T0915.plusSeconds(20), "3512.25", 5),
                            tick("TCS", T0915.plusSeconds(70), "3498", 2)));

            ResponseEntity<StreamingResponseBody> response = controller.getOhlcv("TCS", "2022-04-04", 60);

            assertThat(response.getHeaders().getContentType()).hasToString("text/csv");
            assertThat(render(response))
                    .isEqualTo("""
                            datetime,ticker,open,high,low,close,volume
                            2022-04-04 09:15:00,TCS,3500.0,3512.25,3500.0,3512.25,15
                            2022-04-04 09:16:00,TCS,3498.0,3498.0,3498.0,3498.0,2
                            """);
        }

        @Test
        @DisplayName("an empty result is just the header")
        void emptyResult() throws IOException {
            when(tickStore.fetchTicksInRange(APRIL_4, "NONE")).thenReturn(List.of());

            assertThat(render(controller.getOhlcv("NONE", "2022-04-04", 1)))
                    .isEqualTo("datetime,ticker,open,high,low,close,volume\n");
        }

        @Test
        @DisplayName("starts an asynchronous CSV response")
        void startsStreaming() throws Exception {
            when(tickStore.fetchTicksInRange(APRIL_4, "TCS")).thenReturn(List.of());

            mockMvc.perform(get("/api/ohlcv")
                            .param("symbol", "TCS")
                            .param("date_range", "2022-04-04")
                            .param("frequency", "60"))
                    .andExpect(status().isOk())
                    .andExpect(request().asyncStarted());
        }

        @Test
        @DisplayName("a non-positive frequency is a 400 without touching the store")
        void invalidFrequency() throws Exception {
            mockMvc.perform(get("/api/ohlcv").param("date_range", "2022-04-04").param("frequency", "0"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("INVALID_FREQUENCY"));

            verifyNoInteractions(tickStore);
        }

        @Test
        @DisplayName("a frequency wider than ten years is a 400 without touching the store")
        void frequencyTooWide() throws Exception {
            mockMvc.perform(get("/api/ohlcv")
                            .param("date_range", "2022-04-04")
                            .param("frequency", String.valueOf(Long.MAX_VALUE)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("INVALID_FREQUENCY"));

            verifyNoInteractions(tickStore);
        }

        @Test
        @DisplayName("a non-numeric frequency is a 400")
        void nonNumericFrequency() throws Exception {
            mockMvc.perform(get("/api/ohlcv").param("frequency", "fast"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("an unparsable date range is a 400")
        void invalidDateRange() throws Exception {
            mockMvc.perform(get("/api/ohlcv").param("date_range", "yesterday"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("a storage failure is a 503")
        void storageFailure() throws Exception {
            when(tickStore.fetchTicksInRange(APRIL_4, ""))
                    .thenThrow(new TickStoreException("query failed", new SQLException("timeout")));

            mockMvc.perform(get("/api/ohlcv").param("date_range", "2022-04-04"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error.code").value("STORAGE_ERROR"));
        }

        @Test
        @DisplayName("an untranslated data access failure is also a 503")
        void rawDataAccessFailure() throws Exception {
            when(tickStore.fetchTicksInRange(APRIL_4, "TCS"))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"));

            mockMvc.perform(get("/api/ohlcv").param("symbol", "TCS").param("date_range", "2022-04-04"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error.code").value("STORAGE_ERROR"))
                    .andExpect(jsonPath("$.error.status").value(503))
                    .andExpect(jsonPath("$.error.path").value("/api/ohlcv"));
        }
    }

    @Nested
    @DisplayName("GET /api/ticks")
    class Ticks {

        @Test
        @DisplayName("streams resampled snapshots in the tick column layout")
        void streamsSnapshots() throws IOException {
            Tick first = futuresTick(T0915);
            Tick second = futuresTick(T0915);
            when(tickStore.fetchTicksInRange(APRIL_4, "")).thenReturn(List.of(first, second));

            String csv = render(controller.getTicks("", "2022-04-04", 1));

            assertThat(csv)
                    .isEqualTo("""
                            datetime,ticker,ltp,ltq,buy_price,buy_qty,sell_price,sell_qty,open_interest
                            2022-04-04 09:15:00,NIFTY.FU,17500.0,100,17499.5,100,17500.5,75,1200000
                            """);
        }
    }

    private static Tick futuresTick(LocalDateTime timestamp) {
        return Tick.builder()
                .timestamp(timestamp)
                .instrumentId("NIFTY.FU")
                .lastPrice(new BigDecimal("17500"))
                .lastQty(50L)
                .buyPrice(new BigDecimal("17499.5"))
                .buyQty(100L)
                .sellPrice(new BigDecimal("17500.5"))
                .sellQty(75L)
                .openInterest(1_200_000L)
                .build();
    }

    private static String render(ResponseEntity<StreamingResponseBody> response) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        response.getBody().writeTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static Tick tick(String instrument, LocalDateTime timestamp, String price, long qty) {
        return Tick.builder()
                .timestamp(timestamp)
                .instrumentId(instrument)
                .lastPrice(new BigDecimal(price))
                .lastQty(qty)
                .build();
    }
}
