package com.tickdata.mapper;

import com.tickdata.api.dto.response.MismatchReportResponse;
import com.tickdata.domain.model.MismatchReport;
import com.tickdata.domain.model.MismatchRow;
import com.tickdata.domain.model.MismatchTable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from MismatchReport to the quality-check response.
 *
 * <p>Tables become header-first row lists; interval starts are written with
 * {@link CsvRowFormatter#formatTimestamp} so JSON and CSV outputs agree.
 */
@Mapper
public interface MismatchReportMapper {

    @Mapping(target = "tradeDate", source = "tradeDate")
    @Mapping(target = "rowCountDifference", source = "report.rowCountDifference")
    @Mapping(target = "unmappedReferenceRows", source = "report.unmappedReferenceRows")
    @Mapping(target = "totalMismatches", source = "report.totalMismatches")
    @Mapping(target = "volumeMismatch", source = "report.volumeMismatch")
    @Mapping(target = "highMismatch", source = "report.highMismatch")
    @Mapping(target = "lowMismatch", source = "report.lowMismatch")
    MismatchReportResponse toResponse(LocalDate tradeDate, MismatchReport report);

    default String map(LocalDate date) {
        return date != null ? date.toString() : null;
    }

    default List<List<Object>> map(MismatchTable table) {
        if (table == null) {
            return null;
        }
        List<List<Object>> rows = new ArrayList<>(table.size() + 1);
        rows.add(new ArrayList<>(table.getHeader()));
        for (MismatchRow row : table.getRows()) {
            rows.add(Arrays.asList(
                    CsvRowFormatter.formatTimestamp(row.intervalStart()),
                    row.instrumentId(),
                    row.referenceValue(),
                    row.computedValue()));
        }
        return rows;
    }
}
