package com.fxpipeline.domain.model;

import java.util.List;

/**
 * A record that failed validation, with its position in the input batch.
 */
public record RejectedRecord(int recordIndex, RateObservation record, List<ValidationRule> violations) {

    public RejectedRecord {
        violations = List.copyOf(violations);
    }
}
