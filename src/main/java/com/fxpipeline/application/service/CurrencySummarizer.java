package com.fxpipeline.application.service;

import com.fxpipeline.domain.model.CurrencySummary;
import com.fxpipeline.domain.model.TrendClass;
import com.fxpipeline.domain.model.TrendPoint;
import com.fxpipeline.domain.model.VolatilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reduces each currency's trend series to one summary row.
 */
@Slf4j
public class CurrencySummarizer {

    /**
     * Most observed first, then least volatile, then by currency code.
     */
    public static final Comparator<CurrencySummary> SUMMARY_ORDER = Comparator
            .comparingInt(CurrencySummary::getTotalObservations).reversed()
            .thenComparingDouble(CurrencySummary::getAvgVolatility7d)
            .thenComparing(CurrencySummary::getCurrency);

    public List<CurrencySummary> summarize(List<TrendPoint> trends) {
        Map<String, List<TrendPoint>> byCurrency = trends.stream()
                .collect(Collectors.groupingBy(TrendPoint::getCurrency, TreeMap::new, Collectors.toList()));

        List<CurrencySummary> summaries = new ArrayList<>(byCurrency.size());
        byCurrency.forEach((currency, points) -> summaries.add(summarizeCurrency(currency, points)));
        summaries.sort(SUMMARY_ORDER);

        if (!summaries.isEmpty()) {
            log.info("Currency summaries created: currencies={}", summaries.size());
        }
        return summaries;
    }

    CurrencySummary summarizeCurrency(String currency, List<TrendPoint> points) {
        List<TrendPoint> ordered = new ArrayList<>(points);
        ordered.sort(Comparator.comparing(TrendPoint::getDate));
        TrendPoint current = ordered.get(ordered.size() - 1);

        DescriptiveStatistics rates = new DescriptiveStatistics();
        DescriptiveStatistics volatility = new DescriptiveStatistics();
        DescriptiveStatistics dailyChanges = new DescriptiveStatistics();
        for (TrendPoint point : ordered) {
            rates.addValue(point.getRateMean());
            volatility.addValue(point.getVolatility7d());
            dailyChanges.addValue(point.getDailyChangePct());
        }

        double avgVolatility = volatility.getMean();
        double lastDailyChange = current.getDailyChangePct();

        return CurrencySummary.builder()
                .currency(currency)
                .currentRate(current.getRateMean())
                .movingAvg7d(current.getMovingAvg7d())
                .volatility7d(current.getVolatility7d())
                .relativePositionPct(current.getRelativePositionPct())
                .lastUpdate(current.getMetric().getLastUpdate())
                .lastDailyChange(lastDailyChange)
                .totalChangePct(current.getCumulativeChangePct())
                .historicalMin(rates.getMin())
                .historicalMax(rates.getMax())
                .historicalAvg(rates.getMean())
                .avgVolatility7d(avgVolatility)
                .avgDailyVolatility(dailyChanges.getN() > 1 ? dailyChanges.getStandardDeviation() : 0.0)
                .maxDailyDrop(dailyChanges.getMin())
                .maxDailyGain(dailyChanges.getMax())
                .firstDate(ordered.get(0).getDate())
                .lastDate(current.getDate())
                .totalObservations(ordered.size())
                .volatilityClass(VolatilityClass.classify(avgVolatility))
                .trendClass(TrendClass.classify(lastDailyChange))
                .build();
    }
}
