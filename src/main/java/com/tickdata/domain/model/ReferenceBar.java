package com.tickdata.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * End-of-day bar from the exchange bhavcopy, the authoritative reference for reconciliation.
 *
 * <p>Identity is carried as the raw (symbol, series) pair; the reconciler derives the canonical
 * instrument id from it. Numeric fields are null when the source cell was empty or unparsable,
 * so that such rows still take part in the outer join instead of disappearing.
 */
@Value
@Builder
public class ReferenceBar {

    String symbol;

    /** Series code, e.g. "EQ", "BE", "FUTIDX". */
    String series;

    LocalDate tradeDate;

    Double open;
    Double high;
    Double low;
    Double close;

    /** Total traded quantity for the day. */
    Long volume;
}
