package com.tickdata.domain.model;

import com.tickdata.domain.enums.MismatchType;
import java.util.List;
import lombok.Value;

/**
 * Mismatches of one {@link MismatchType}, with the header naming the two value columns.
 *
 * <p>Rows are ordered by (intervalStart, instrumentId). A table is never empty: the reconciler
 * reports an absent table instead.
 */
@Value
public class MismatchTable {

    public static final String INTERVAL_START_COLUMN = "interval_start";
    public static final String INSTRUMENT_ID_COLUMN = "instrument_id";

    MismatchType type;
    List<String> header;
    List<MismatchRow> rows;

    public static MismatchTable of(MismatchType type, List<MismatchRow> rows) {
        List<String> header = List.of(
                INTERVAL_START_COLUMN,
                INSTRUMENT_ID_COLUMN,
                type.getFieldName() + "_reference",
                type.getFieldName() + "_computed");
        return new MismatchTable(type, header, List.copyOf(rows));
    }

    public int size() {
        return rows.size();
    }
}
