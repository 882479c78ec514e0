package com.fxpipeline.application.service;

import com.fxpipeline.domain.model.QualityReport;
import com.fxpipeline.domain.model.QualityReport.Completeness;
import com.fxpipeline.domain.model.QualityReport.CurrencyConsistency;
import com.fxpipeline.domain.model.QualityReport.RateDistribution;
import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.rule.CurrencyCodeRule;
import com.fxpipeline.domain.rule.RateRangeRule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scores a batch of rate observations between 0 and 1.
 *
 * <p>{@code overall = 1 - 0.3 * missingRatio - 0.4 * invalidRateRatio - 0.3 * invalidCurrencyRatio},
 * floored at 0. Each call is independent; issues are collected per call.
 */
@Slf4j
public class QualityScorer {

    static final double MISSING_WEIGHT = 0.3;
    static final double INVALID_RATE_WEIGHT = 0.4;
    static final double INVALID_CURRENCY_WEIGHT = 0.3;

    // Informational only, does not affect the score
    static final double EXTREME_RATE_THRESHOLD = 1000.0;

    private static final String[] COLUMNS = {
            "base_currency", "target_currency", "rate", "observed_at",
            "collected_at", "collection_date", "pipeline_version"
    };

    public QualityReport assess(List<RateObservation> records) {
        List<String> issues = new ArrayList<>();

        if (records.isEmpty()) {
            issues.add("Batch contains no records");
            return new QualityReport(0,
                    new Completeness(Map.of(), 0.0),
                    new CurrencyConsistency(0, 0, List.of(), List.of()),
                    new RateDistribution(0, 0, 0, 0, 0, 0, 0, 0),
                    issues, 0.0);
        }

        Completeness completeness = checkCompleteness(records, issues);
        CurrencyConsistency consistency = checkCurrencyConsistency(records, issues);
        RateDistribution distribution = checkRateDistribution(records, issues);
        double overallScore = calculateOverallScore(records);

        log.info("Quality assessed: records={}, score={}, issues={}",
                records.size(), String.format("%.4f", overallScore), issues.size());
        return new QualityReport(records.size(), completeness, consistency, distribution, issues, overallScore);
    }

    private Completeness checkCompleteness(List<RateObservation> records, List<String> issues) {
        Map<String, Integer> missing = new LinkedHashMap<>();
        for (String column : COLUMNS) {
            missing.put(column, 0);
        }
        for (RateObservation record : records) {
            countIfNull(missing, "base_currency", record.getBaseCurrency());
            countIfNull(missing, "target_currency", record.getTargetCurrency());
            countIfNull(missing, "rate", record.getRate());
            countIfNull(missing, "observed_at", record.getObservedAt());
            countIfNull(missing, "collected_at", record.getCollectedAt());
            countIfNull(missing, "collection_date", record.getCollectionDate());
            countIfNull(missing, "pipeline_version", record.getPipelineVersion());
        }

        int totalMissing = missing.values().stream().mapToInt(Integer::intValue).sum();
        if (totalMissing > 0) {
            Map<String, Integer> nonZero = new LinkedHashMap<>();
            missing.forEach((column, count) -> {
                if (count > 0) {
                    nonZero.put(column, count);
                }
            });
            issues.add("Missing values found: " + nonZero);
        }

        double score = 1.0 - (double) totalMissing / ((long) RateObservation.COLUMN_COUNT * records.size());
        return new Completeness(missing, score);
    }

    private void countIfNull(Map<String, Integer> missing, String column, Object value) {
        if (value == null) {
            missing.merge(column, 1, Integer::sum);
        }
    }

    private CurrencyConsistency checkCurrencyConsistency(List<RateObservation> records, List<String> issues) {
        Set<String> baseCurrencies = new LinkedHashSet<>();
        Set<String> targetCurrencies = new LinkedHashSet<>();
        for (RateObservation record : records) {
            baseCurrencies.add(record.getBaseCurrency());
            targetCurrencies.add(record.getTargetCurrency());
        }

        Set<String> allCodes = new LinkedHashSet<>(baseCurrencies);
        allCodes.addAll(targetCurrencies);

        List<String> invalidCodes = new ArrayList<>();
        List<String> unrecognizedCodes = new ArrayList<>();
        for (String code : allCodes) {
            if (!CurrencyCodeRule.isWellFormed(code)) {
                invalidCodes.add(String.valueOf(code));
            } else if (!CurrencyCodeRule.isRecognized(code)) {
                unrecognizedCodes.add(code);
            }
        }

        if (!invalidCodes.isEmpty()) {
            issues.add("Invalid currency codes: " + invalidCodes);
        }
        if (!unrecognizedCodes.isEmpty()) {
            issues.add("Unrecognized currency codes: " + unrecognizedCodes);
        }
        if (baseCurrencies.size() > 1) {
            issues.add("Multiple base currencies found: " + baseCurrencies.size());
        }

        return new CurrencyConsistency(baseCurrencies.size(), targetCurrencies.size(), invalidCodes, unrecognizedCodes);
    }

    private RateDistribution checkRateDistribution(List<RateObservation> records, List<String> issues) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        int zeroCount = 0;
        int negativeCount = 0;
        int extremeCount = 0;

        for (RateObservation record : records) {
            Double rate = record.getRate();
            if (rate == null || rate.isNaN()) {
                continue;
            }
            stats.addValue(rate);
            if (rate == 0.0) {
                zeroCount++;
            } else if (rate < 0) {
                negativeCount++;
            } else if (rate > EXTREME_RATE_THRESHOLD) {
                extremeCount++;
            }
        }

        if (zeroCount > 0) {
            issues.add("Found " + zeroCount + " zero rates");
        }
        if (negativeCount > 0) {
            issues.add("Found " + negativeCount + " negative rates");
        }
        if (extremeCount > 0) {
            issues.add("Found " + extremeCount + " extreme rates (>" + (int) EXTREME_RATE_THRESHOLD + ")");
        }

        if (stats.getN() == 0) {
            return new RateDistribution(0, 0, 0, 0, 0, zeroCount, negativeCount, extremeCount);
        }
        return new RateDistribution(
                stats.getMin(),
                stats.getMax(),
                stats.getMean(),
                stats.getPercentile(50),
                stats.getStandardDeviation(),
                zeroCount,
                negativeCount,
                extremeCount
        );
    }

    private double calculateOverallScore(List<RateObservation> records) {
        int rows = records.size();

        long missingCells = records.stream().mapToLong(RateObservation::missingFieldCount).sum();
        double missingRatio = (double) missingCells / ((long) rows * RateObservation.COLUMN_COUNT);

        long invalidRates = records.stream()
                .map(RateObservation::getRate)
                .filter(Objects::nonNull)
                .filter(rate -> RateRangeRule.isOutOfRange(rate))
                .count();
        double invalidRateRatio = (double) invalidRates / rows;

        long invalidCurrencies = 0;
        for (RateObservation record : records) {
            if (!CurrencyCodeRule.isStrictlyFormed(record.getBaseCurrency())) {
                invalidCurrencies++;
            }
            if (!CurrencyCodeRule.isStrictlyFormed(record.getTargetCurrency())) {
                invalidCurrencies++;
            }
        }
        double invalidCurrencyRatio = (double) invalidCurrencies / (rows * 2L);

        double score = 1.0
                - MISSING_WEIGHT * missingRatio
                - INVALID_RATE_WEIGHT * invalidRateRatio
                - INVALID_CURRENCY_WEIGHT * invalidCurrencyRatio;
        return Math.max(0.0, score);
    }
}
