package com.tickdata.ingestion;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Column lookup for the vendor CSV files, by case-insensitive header name.
 *
 * <p>The vendor files are plain comma-separated values without quoting, so a split on commas
 * is enough. Cells are trimmed; empty cells read as null.
 */
final class CsvHeader {

    private final Map<String, Integer> columns;

    private CsvHeader(Map<String, Integer> columns) {
        this.columns = columns;
    }

    static CsvHeader parse(String headerLine) {
        String line = headerLine.startsWith("\uFEFF") ? headerLine.substring(1) : headerLine;
        Map<String, Integer> columns = new HashMap<>();
        String[] names = split(line);
        for (int i = 0; i < names.length; i++) {
            columns.putIfAbsent(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        return new CsvHeader(columns);
    }

    static String[] split(String line) {
        return line.split(",", -1);
    }

    String get(String[] cells, String column) {
        Integer index = columns.get(column.toLowerCase(Locale.ROOT));
        if (index == null || index >= cells.length) {
            return null;
        }
        String value = cells[index].trim();
        return value.isEmpty() ? null : value;
    }

    /** Parses a decimal cell; null for an empty cell, NumberFormatException for garbage. */
    BigDecimal getDecimal(String[] cells, String column) {
        String value = get(cells, column);
        return value != null ? new BigDecimal(value) : null;
    }

    /**
     * Parses a quantity cell, accepting "10" as well as "10.0".
     *
     * @throws ArithmeticException if the value has a fractional part or does not fit in a long
     */
    Long getLong(String[] cells, String column) {
        BigDecimal value = getDecimal(cells, column);
        return value != null ? value.longValueExact() : null;
    }
}
