package com.tickdata.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One trade/quote event for an instrument, as read from the tick-by-tick archive or the tick store.
 *
 * <p>Ticks are the only input of the aggregation engine. They are transient: produced by the
 * ingestion layer or fetched from storage, consumed once per request, never cached.
 *
 * <p>Every field is nullable so that partially populated rows can reach the aggregators, which
 * decide per {@link com.tickdata.domain.enums.MalformedTickPolicy} whether to drop or reject them.
 * Quote-side fields may legitimately be absent or zero. {@code openInterest} is only meaningful
 * for derivatives.
 */
@Value
@Builder
public class Tick {

    /** Exchange timestamp of the trade (exchange-local, no zone). */
    LocalDateTime timestamp;

    /** Canonical instrument id, e.g. "TCS" or "NIFTY.FU". */
    String instrumentId;

    /** Last traded price. */
    BigDecimal lastPrice;

    /** Last traded quantity. */
    Long lastQty;

    /** Best bid price. */
    BigDecimal buyPrice;

    /** Best bid quantity. */
    Long buyQty;

    /** Best ask price. */
    BigDecimal sellPrice;

    /** Best ask quantity. */
    Long sellQty;

    /** Open interest, derivatives only. */
    Long openInterest;
}
