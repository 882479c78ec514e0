package com.fxpipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Quality assessment of one validated batch. Read-only once built.
 */
public record QualityReport(
        @JsonProperty("total_records") int totalRecords,
        @JsonProperty("completeness") Completeness completeness,
        @JsonProperty("currency_consistency") CurrencyConsistency currencyConsistency,
        @JsonProperty("rate_distribution") RateDistribution rateDistribution,
        @JsonProperty("issues") List<String> issues,
        @JsonProperty("overall_score") double overallScore
) {

    public QualityReport {
        issues = List.copyOf(issues);
    }

    public record Completeness(
            @JsonProperty("missing_values") Map<String, Integer> missingValues,
            @JsonProperty("completeness_score") double completenessScore
    ) {}

    public record CurrencyConsistency(
            @JsonProperty("unique_base_currencies") int uniqueBaseCurrencies,
            @JsonProperty("unique_target_currencies") int uniqueTargetCurrencies,
            @JsonProperty("invalid_codes") List<String> invalidCodes,
            @JsonProperty("unrecognized_codes") List<String> unrecognizedCodes
    ) {}

    public record RateDistribution(
            @JsonProperty("min") double min,
            @JsonProperty("max") double max,
            @JsonProperty("mean") double mean,
            @JsonProperty("median") double median,
            @JsonProperty("std") double std,
            @JsonProperty("zero_count") int zeroCount,
            @JsonProperty("negative_count") int negativeCount,
            @JsonProperty("extreme_count") int extremeCount
    ) {}
}
