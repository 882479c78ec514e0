package com.fxpipeline.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One provider response: a base currency priced against many target currencies.
 * Rates keep the provider's ordering; a rate may be null when the provider sent a non-numeric value.
 */
@Value
@Builder
public class RateSnapshot {
    String baseCurrency;
    LocalDateTime collectedAt;      // Pipeline collection time
    LocalDateTime observedAt;       // Provider "last update"
    LocalDate snapshotDate;         // Date the raw file is keyed by
    String pipelineVersion;
    @Singular
    Map<String, Double> rates;      // target code -> rate

    public boolean isEmpty() {
        return rates.isEmpty();
    }
}
