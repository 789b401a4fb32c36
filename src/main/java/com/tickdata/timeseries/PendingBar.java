package com.tickdata.timeseries;

import com.tickdata.domain.model.Bar;
import com.tickdata.domain.model.Tick;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;

/**
 * Accumulates the ticks (or finer bars) of one bucket into OHLCV values.
 *
 * <p>Inputs must arrive in time order: the first update sets open, every update moves close.
 * Prices are compared as BigDecimal and only converted to double when the bar is emitted.
 * Instances are confined to a single aggregation call, so no synchronization is needed.
 */
@Getter
public class PendingBar {

    private final String instrumentId;
    private final LocalDateTime intervalStart;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private long volume;

    public PendingBar(String instrumentId, LocalDateTime intervalStart) {
        this.instrumentId = instrumentId;
        this.intervalStart = intervalStart;
    }

    /**
     * Incorporates a tick. The tick must carry a last price and quantity.
     */
    public void update(Tick tick) {
        updatePrices(tick.getLastPrice(), tick.getLastPrice(), tick.getLastPrice(), tick.getLastPrice());
        volume += tick.getLastQty();
    }

    /**
     * Incorporates an already-built bar of a finer (or equal) frequency.
     */
    public void update(Bar bar) {
        updatePrices(
                BigDecimal.valueOf(bar.getOpen()),
                BigDecimal.valueOf(bar.getHigh()),
                BigDecimal.valueOf(bar.getLow()),
                BigDecimal.valueOf(bar.getClose()));
        volume += bar.getVolume();
    }

    private void updatePrices(BigDecimal first, BigDecimal max, BigDecimal min, BigDecimal last) {
        if (open == null) {
            open = first;
            high = max;
            low = min;
        }

        if (max.compareTo(high) > 0) {
            high = max;
        }
        if (min.compareTo(low) < 0) {
            low = min;
        }

        close = last;
    }

    /** Returns true if at least one input has been received. */
    public boolean hasData() {
        return open != null;
    }

    public Bar toBar() {
        return Bar.builder()
                .instrumentId(instrumentId)
                .intervalStart(intervalStart)
                .open(open.doubleValue())
                .high(high.doubleValue())
                .low(low.doubleValue())
                .close(close.doubleValue())
                .volume(volume)
                .build();
    }
}
