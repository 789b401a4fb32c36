package com.tickdata.mapper;

import com.tickdata.domain.model.Bar;
import com.tickdata.domain.model.ResampledSnapshot;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Renders snapshots and bars as CSV lines for the streaming market-data endpoints.
 *
 * <p>Column names and order are part of the wire contract and must not change. Timestamps are
 * written as {@code yyyy-MM-dd HH:mm:ss}; prices in plain decimal notation.
 */
public final class CsvRowFormatter {

    public static final String SNAPSHOT_HEADER =
            "datetime,ticker,ltp,ltq,buy_price,buy_qty,sell_price,sell_qty,open_interest";

    public static final String BAR_HEADER = "datetime,ticker,open,high,low,close,volume";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private CsvRowFormatter() {}

    public static String formatTimestamp(LocalDateTime timestamp) {
        return timestamp != null ? TIMESTAMP_FORMAT.format(timestamp) : null;
    }

    public static String toCsvLine(ResampledSnapshot snapshot) {
        return String.join(
                ",",
                formatTimestamp(snapshot.getIntervalStart()),
                snapshot.getInstrumentId(),
                formatPrice(snapshot.getLastPrice()),
                Long.toString(snapshot.getLastQtyTotal()),
                formatPrice(snapshot.getBuyPrice()),
                Long.toString(snapshot.getBuyQty()),
                formatPrice(snapshot.getSellPrice()),
                Long.toString(snapshot.getSellQty()),
                Long.toString(snapshot.getOpenInterest()));
    }

    public static String toCsvLine(Bar bar) {
        return String.join(
                ",",
                formatTimestamp(bar.getIntervalStart()),
                bar.getInstrumentId(),
                formatPrice(bar.getOpen()),
                formatPrice(bar.getHigh()),
                formatPrice(bar.getLow()),
                formatPrice(bar.getClose()),
                Long.toString(bar.getVolume()));
    }

    // 100.0 stays "100.0", 1.0E7 becomes "10000000"
    static String formatPrice(double price) {
        return BigDecimal.valueOf(price).toPlainString();
    }
}
