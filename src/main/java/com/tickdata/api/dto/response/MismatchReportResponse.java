package com.tickdata.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * DTO for the bhavcopy reconciliation report of one trade date.
 *
 * <p>Each mismatch table is rendered as a list of rows whose first row is the header
 * ({@code interval_start, instrument_id, <field>_reference, <field>_computed}). A table is null
 * when that check found no mismatches.
 */
@Data
@Builder
public class MismatchReportResponse {

    private String tradeDate;

    private int rowCountDifference;

    private int unmappedReferenceRows;

    private int totalMismatches;

    private List<List<Object>> volumeMismatch;

    private List<List<Object>> highMismatch;

    private List<List<Object>> lowMismatch;
}
