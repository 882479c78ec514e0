package com.fxpipeline.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Canonical per-currency-pair record.
 * Immutable; later stages derive new values instead of mutating this one.
 */
@Value
@Builder(toBuilder = true)
public class RateObservation {
    public static final int COLUMN_COUNT = 7;

    String baseCurrency;        // ISO 4217 code
    String targetCurrency;      // ISO 4217 code
    Double rate;
    LocalDateTime observedAt;
    LocalDateTime collectedAt;
    LocalDate collectionDate;
    String pipelineVersion;

    /**
     * Number of null cells in this record, used for completeness scoring.
     */
    public int missingFieldCount() {
        int missing = 0;
        if (baseCurrency == null) missing++;
        if (targetCurrency == null) missing++;
        if (rate == null) missing++;
        if (observedAt == null) missing++;
        if (collectedAt == null) missing++;
        if (collectionDate == null) missing++;
        if (pipelineVersion == null) missing++;
        return missing;
    }

    public String getPairKey() {
        return baseCurrency + "/" + targetCurrency;
    }
}
