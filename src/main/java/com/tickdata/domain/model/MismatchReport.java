package com.tickdata.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of reconciling bhavcopy bars against bars computed from stored ticks for one trade date.
 *
 * <p>{@code rowCountDifference} is reference rows minus computed rows, taken before the join.
 * Reference rows whose (symbol, series) could not be mapped to an instrument id are left out of
 * the join but still counted there, and are reported in {@code unmappedReferenceRows}.
 *
 * <p>Each mismatch table is null when that check found nothing.
 */
@Value
@Builder
public class MismatchReport {

    int rowCountDifference;

    int unmappedReferenceRows;

    MismatchTable volumeMismatch;

    MismatchTable highMismatch;

    MismatchTable lowMismatch;

    public boolean hasMismatches() {
        return volumeMismatch != null || highMismatch != null || lowMismatch != null;
    }

    public int getTotalMismatches() {
        return sizeOf(volumeMismatch) + sizeOf(highMismatch) + sizeOf(lowMismatch);
    }

    private static int sizeOf(MismatchTable table) {
        return table != null ? table.size() : 0;
    }
}
