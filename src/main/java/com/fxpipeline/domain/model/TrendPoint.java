package com.fxpipeline.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A daily metric enriched with rolling trend fields.
 * Rolling values only look at the same currency's earlier points.
 */
@Value
@Builder
public class TrendPoint {
    DailyMetric metric;
    double dailyChangePct;
    double cumulativeChangePct;
    double movingAvg7d;
    double volatility7d;
    double max30d;
    double min30d;
    double relativePositionPct;

    public LocalDate getDate() {
        return metric.getDate();
    }

    public String getCurrency() {
        return metric.getCurrency();
    }

    public double getRateMean() {
        return metric.getRateMean();
    }
}
