package com.tickdata.api.controller;

import com.tickdata.domain.model.Bar;
import com.tickdata.domain.model.DateRange;
import com.tickdata.domain.model.ResampledSnapshot;
import com.tickdata.mapper.CsvRowFormatter;
import com.tickdata.service.MarketDataService;
import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Function;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * REST endpoints streaming resampled ticks and OHLCV bars as CSV.
 *
 * <p>Rows are computed before the response starts, so an invalid frequency, a bad date range or
 * a storage failure is answered with a JSON error instead of a truncated CSV. The body is then
 * written line by line.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/ticks?symbol={}&date_range={}&frequency={}</li>
 *   <li>GET /api/ohlcv?symbol={}&date_range={}&frequency={}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class MarketDataController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final MarketDataService marketDataService;

    public MarketDataController(MarketDataService marketDataService) {
        this.marketDataService = marketDataService;
    }

    /**
     * Resampled tick snapshots for an instrument (or all instruments) over a date range.
     *
     * @param symbol    instrument id; empty selects all instruments
     * @param dateRange {@code start:end} in ISO dates, either side optional; empty selects today
     * @param frequency bucket width in seconds
     */
    @GetMapping("/ticks")
    public ResponseEntity<StreamingResponseBody> getTicks(
            @RequestParam(defaultValue = "") String symbol,
            @RequestParam(name = "date_range", defaultValue = "") String dateRange,
            @RequestParam(defaultValue = "1") long frequency) {

        List<ResampledSnapshot> snapshots =
                marketDataService.getSnapshots(symbol, DateRange.parse(dateRange), frequency);
        return csv(CsvRowFormatter.SNAPSHOT_HEADER, snapshots, CsvRowFormatter::toCsvLine);
    }

    /**
     * OHLCV bars for an instrument (or all instruments) over a date range.
     *
     * @param symbol    instrument id; empty selects all instruments
     * @param dateRange {@code start:end} in ISO dates, either side optional; empty selects today
     * @param frequency bar width in seconds
     */
    @GetMapping("/ohlcv")
    public ResponseEntity<StreamingResponseBody> getOhlcv(
            @RequestParam(defaultValue = "") String symbol,
            @RequestParam(name = "date_range", defaultValue = "") String dateRange,
            @RequestParam(defaultValue = "1") long frequency) {

        List<Bar> bars = marketDataService.getBars(symbol, DateRange.parse(dateRange), frequency);
        return csv(CsvRowFormatter.BAR_HEADER, bars, CsvRowFormatter::toCsvLine);
    }

    private static <T> ResponseEntity<StreamingResponseBody> csv(
            String header, List<T> rows, Function<T, String> formatter) {
        StreamingResponseBody body = outputStream -> {
            Writer writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
            writer.write(header);
            writer.write('\n');
            for (T row : rows) {
                writer.write(formatter.apply(row));
                writer.write('\n');
            }
            writer.flush();
        };
        return ResponseEntity.ok().contentType(TEXT_CSV).body(body);
    }
}
