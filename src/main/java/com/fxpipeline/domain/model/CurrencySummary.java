package com.fxpipeline.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Current state and history of one currency over the analysed period.
 */
@Value
@Builder(toBuilder = true)
public class CurrencySummary {
    String currency;

    // Current state (last trend point)
    double currentRate;
    double movingAvg7d;
    double volatility7d;
    double relativePositionPct;
    LocalDateTime lastUpdate;
    double lastDailyChange;
    double totalChangePct;

    // History
    double historicalMin;
    double historicalMax;
    double historicalAvg;
    double avgVolatility7d;
    double avgDailyVolatility;
    double maxDailyDrop;
    double maxDailyGain;
    LocalDate firstDate;
    LocalDate lastDate;
    int totalObservations;

    VolatilityClass volatilityClass;
    TrendClass trendClass;
}
