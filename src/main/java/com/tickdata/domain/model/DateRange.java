package com.tickdata.domain.model;

import com.tickdata.exception.InvalidDateRangeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Inclusive range of calendar dates used to select ticks.
 *
 * <p>Parsed from the query-string form {@code "start:end"}. Either side may be omitted
 * ({@code "2022-04-01:"} or {@code ":2022-04-04"}), in which case it collapses onto the other;
 * a single date selects that day; an empty value selects today.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new InvalidDateRangeException("Date range bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new InvalidDateRangeException("Date range end " + end + " is before start " + start);
        }
    }

    public static DateRange of(LocalDate date) {
        return new DateRange(date, date);
    }

    public static DateRange parse(String value) {
        return parse(value, LocalDate.now());
    }

    /**
     * Parses a date range string, using {@code today} when the value is empty.
     *
     * @throws InvalidDateRangeException if either date is not ISO yyyy-MM-dd or the range is inverted
     */
    public static DateRange parse(String value, LocalDate today) {
        if (value == null || value.isBlank()) {
            return of(today);
        }
        String[] parts = value.trim().split(":", -1);
        if (parts.length > 2) {
            throw new InvalidDateRangeException("Invalid date range: " + value);
        }
        LocalDate start = parseDate(parts[0], value);
        LocalDate end = parts.length == 2 ? parseDate(parts[1], value) : start;
        if (start == null && end == null) {
            return of(today);
        }
        return new DateRange(start != null ? start : end, end != null ? end : start);
    }

    /** First instant of the range, inclusive. */
    public LocalDateTime startInclusive() {
        return start.atStartOfDay();
    }

    /** Midnight after the last day of the range, exclusive. */
    public LocalDateTime endExclusive() {
        return end.plusDays(1).atStartOfDay();
    }

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(startInclusive()) && timestamp.isBefore(endExclusive());
    }

    private static LocalDate parseDate(String part, String original) {
        if (part.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(part.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidDateRangeException("Invalid date in range '" + original + "': " + part, e);
        }
    }
}
