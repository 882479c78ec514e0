package com.fxpipeline.domain.model;

import java.util.List;

/**
 * Everything one aggregation run produces, written together or not at all.
 */
public record AnalyticsDataset(
        List<DailyMetric> dailyMetrics,
        List<TrendPoint> trends,
        List<CurrencySummary> summaries,
        MarketOverview overview
) {

    public AnalyticsDataset {
        dailyMetrics = List.copyOf(dailyMetrics);
        trends = List.copyOf(trends);
        summaries = List.copyOf(summaries);
    }
}
