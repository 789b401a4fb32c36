package com.tickdata.domain.model;

import java.time.LocalDateTime;

/**
 * One row of a mismatch table. Either value is null when the row exists on one side only.
 */
public record MismatchRow(LocalDateTime intervalStart, String instrumentId, Number referenceValue, Number computedValue) {}
