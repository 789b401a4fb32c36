package com.tickdata.domain.enums;

/**
 * Classification of discrepancies between bhavcopy bars (reference) and bars computed from ticks.
 *
 * <p>VOLUME = volumes differ, including a value present on one side only.
 * HIGH = reference high is below the computed high (the reverse is not flagged).
 * LOW = reference low is above the computed low (the reverse is not flagged).
 */
public enum MismatchType {
    VOLUME("volume"),
    HIGH("high"),
    LOW("low");

    private final String fieldName;

    MismatchType(String fieldName) {
        this.fieldName = fieldName;
    }

    /** Bar field compared by this mismatch type, used in report column names. */
    public String getFieldName() {
        return fieldName;
    }
}
