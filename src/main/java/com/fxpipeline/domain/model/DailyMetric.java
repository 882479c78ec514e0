package com.fxpipeline.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Statistics of one currency's observations on one date. Unique per (date, currency).
 */
@Value
@Builder
public class DailyMetric {
    LocalDate date;
    String currency;
    double rateMean;
    double rateStd;             // Sample standard deviation, 0 for a single observation
    double rateMin;
    double rateMax;
    int observationCount;
    double rateRange;
    double coefficientOfVariation;
    LocalDateTime lastUpdate;   // Latest collection time in the group
}
