package com.fxpipeline.domain.model;

/**
 * Identifiers of the record-level rules a rate observation can violate.
 */
public enum ValidationRule {
    MISSING_FIELD("MISSING_FIELD"),
    CURRENCY_CODE_FORMAT("CURRENCY_CODE_FORMAT"),
    CURRENCY_PAIR_DISTINCT("CURRENCY_PAIR_DISTINCT"),
    UNRECOGNIZED_CURRENCY("UNRECOGNIZED_CURRENCY"),
    RATE_RANGE("RATE_RANGE"),
    TIMESTAMP_RANGE("TIMESTAMP_RANGE"),
    COLLECTION_WINDOW("COLLECTION_WINDOW");

    private final String value;

    ValidationRule(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ValidationRule fromValue(String value) {
        for (ValidationRule rule : values()) {
            if (rule.value.equalsIgnoreCase(value)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown validation rule: " + value);
    }
}
