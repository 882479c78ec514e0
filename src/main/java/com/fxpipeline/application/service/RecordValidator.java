package com.fxpipeline.application.service;

import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.model.RejectedRecord;
import com.fxpipeline.domain.model.ValidationOutcome;
import com.fxpipeline.domain.model.ValidationRule;
import com.fxpipeline.domain.rule.CurrencyCodeRule;
import com.fxpipeline.domain.rule.RateRangeRule;
import com.fxpipeline.domain.rule.TimestampRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates rate observations record by record.
 * Rejections are returned as values; this class never fails a batch.
 */
@Slf4j
public class RecordValidator {

    private static final int LOGGED_SAMPLES = 3;

    private final boolean strictCurrencyCodes;

    public RecordValidator() {
        this(false);
    }

    /**
     * @param strictCurrencyCodes also reject well-formed codes that are not known ISO 4217 currencies
     */
    public RecordValidator(boolean strictCurrencyCodes) {
        this.strictCurrencyCodes = strictCurrencyCodes;
    }

    public ValidationOutcome validate(List<RateObservation> records) {
        log.info("Validating {} records", records.size());

        List<RateObservation> accepted = new ArrayList<>();
        List<RejectedRecord> rejected = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            RateObservation record = records.get(i);
            List<ValidationRule> violations = validate(record);
            if (violations.isEmpty()) {
                accepted.add(canonicalize(record));
            } else {
                log.warn("Record {} ({}) rejected: {}", i, record.getPairKey(), violations);
                rejected.add(new RejectedRecord(i, record, violations));
            }
        }

        ValidationOutcome outcome = new ValidationOutcome(accepted, rejected);
        log.info("Validation finished: accepted={}, rejected={}, successRate={}",
                accepted.size(), rejected.size(), String.format("%.4f", outcome.successRate()));
        if (!rejected.isEmpty()) {
            log.error("{} records failed validation, samples: {}",
                    rejected.size(), outcome.rejectionSamples(LOGGED_SAMPLES));
        }
        return outcome;
    }

    /**
     * Evaluates every rule independently and returns all that fail.
     */
    public List<ValidationRule> validate(RateObservation record) {
        List<ValidationRule> violations = new ArrayList<>();

        if (record.missingFieldCount() > 0) {
            violations.add(ValidationRule.MISSING_FIELD);
        }

        validateCurrencies(record, violations);

        if (!RateRangeRule.isValid(record.getRate())) {
            violations.add(ValidationRule.RATE_RANGE);
        }

        validateTimestamps(record, violations);

        return violations;
    }

    private void validateCurrencies(RateObservation record, List<ValidationRule> violations) {
        String base = record.getBaseCurrency();
        String target = record.getTargetCurrency();

        if (!CurrencyCodeRule.isWellFormed(base) || !CurrencyCodeRule.isWellFormed(target)) {
            violations.add(ValidationRule.CURRENCY_CODE_FORMAT);
            return;
        }

        if (CurrencyCodeRule.normalize(base).equals(CurrencyCodeRule.normalize(target))) {
            violations.add(ValidationRule.CURRENCY_PAIR_DISTINCT);
        }

        if (strictCurrencyCodes && (!CurrencyCodeRule.isRecognized(base) || !CurrencyCodeRule.isRecognized(target))) {
            violations.add(ValidationRule.UNRECOGNIZED_CURRENCY);
        }
    }

    private void validateTimestamps(RateObservation record, List<ValidationRule> violations) {
        if (!TimestampRule.isWithinYearRange(record.getObservedAt())
                || !TimestampRule.isWithinYearRange(record.getCollectedAt())) {
            violations.add(ValidationRule.TIMESTAMP_RANGE);
        }

        if (record.getObservedAt() != null && record.getCollectedAt() != null
                && !TimestampRule.isReasonableCollectionTime(record.getCollectedAt(), record.getObservedAt())) {
            violations.add(ValidationRule.COLLECTION_WINDOW);
        }
    }

    private RateObservation canonicalize(RateObservation record) {
        return record.toBuilder()
                .baseCurrency(CurrencyCodeRule.normalize(record.getBaseCurrency()))
                .targetCurrency(CurrencyCodeRule.normalize(record.getTargetCurrency()))
                .rate(RateRangeRule.round(record.getRate()))
                .build();
    }
}
