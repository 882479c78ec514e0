package com.fxpipeline.adapter.out.persistence;

import com.fxpipeline.domain.model.CurrencySummary;

/**
 * Compact projection of a currency summary for quick lookups.
 */
public record ConsolidatedRow(
        String currency,
        double currentRate,
        double lastDailyChange,
        double totalChangePct,
        double movingAvg7d,
        double volatility7d,
        String trendClass,
        String volatilityClass
) {
    public static ConsolidatedRow from(CurrencySummary summary) {
        return new ConsolidatedRow(
                summary.getCurrency(),
                summary.getCurrentRate(),
                summary.getLastDailyChange(),
                summary.getTotalChangePct(),
                summary.getMovingAvg7d(),
                summary.getVolatility7d(),
                summary.getTrendClass().getValue(),
                summary.getVolatilityClass().getValue());
    }
}
