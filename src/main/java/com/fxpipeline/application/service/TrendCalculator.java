package com.fxpipeline.application.service;

import com.fxpipeline.domain.model.DailyMetric;
import com.fxpipeline.domain.model.TrendPoint;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Derives rolling trend fields per currency.
 *
 * <p>Windows are trailing and include the current point. Each currency's series is computed from
 * its own points only, so currencies can be processed in parallel.
 */
@Slf4j
public class TrendCalculator {

    static final int SHORT_WINDOW = 7;
    static final int LONG_WINDOW = 30;
    static final double NEUTRAL_POSITION = 50.0;

    private final boolean parallel;

    public TrendCalculator() {
        this(false);
    }

    public TrendCalculator(boolean parallel) {
        this.parallel = parallel;
    }

    /**
     * @return trend points ordered by currency, then date
     */
    public List<TrendPoint> calculate(List<DailyMetric> metrics) {
        Map<String, List<DailyMetric>> byCurrency = metrics.stream()
                .collect(Collectors.groupingBy(DailyMetric::getCurrency, TreeMap::new, Collectors.toList()));

        Stream<List<DailyMetric>> series = byCurrency.values().stream();
        if (parallel) {
            series = series.parallel();
        }

        List<TrendPoint> trends = series
                .map(this::calculateSeries)
                .flatMap(List::stream)
                .collect(Collectors.toList());

        log.info("Trends calculated: currencies={}, points={}", byCurrency.size(), trends.size());
        return trends;
    }

    /**
     * Trend points for a single currency. With one point every change is 0, the rolling
     * values equal the rate and the relative position is neutral.
     */
    public List<TrendPoint> calculateSeries(List<DailyMetric> currencyMetrics) {
        List<DailyMetric> ordered = new ArrayList<>(currencyMetrics);
        ordered.sort(Comparator.comparing(DailyMetric::getDate));

        DescriptiveStatistics changeWindow = new DescriptiveStatistics(SHORT_WINDOW);
        DescriptiveStatistics rateWindow = new DescriptiveStatistics(SHORT_WINDOW);
        DescriptiveStatistics extremesWindow = new DescriptiveStatistics(LONG_WINDOW);

        List<TrendPoint> points = new ArrayList<>(ordered.size());
        double firstRate = ordered.isEmpty() ? 0.0 : ordered.get(0).getRateMean();
        double previousRate = firstRate;

        for (int i = 0; i < ordered.size(); i++) {
            DailyMetric metric = ordered.get(i);
            double rate = metric.getRateMean();

            double dailyChange = i == 0 ? 0.0 : percentChange(previousRate, rate);
            double cumulativeChange = i == 0 ? 0.0 : percentChange(firstRate, rate);

            changeWindow.addValue(dailyChange);
            rateWindow.addValue(rate);
            extremesWindow.addValue(rate);

            double volatility = changeWindow.getN() > 1 ? changeWindow.getStandardDeviation() : 0.0;
            double max30d = extremesWindow.getMax();
            double min30d = extremesWindow.getMin();
            double range = max30d - min30d;
            double relativePosition = range > 0 ? (rate - min30d) / range * 100 : NEUTRAL_POSITION;

            points.add(TrendPoint.builder()
                    .metric(metric)
                    .dailyChangePct(dailyChange)
                    .cumulativeChangePct(cumulativeChange)
                    .movingAvg7d(rateWindow.getMean())
                    .volatility7d(volatility)
                    .max30d(max30d)
                    .min30d(min30d)
                    .relativePositionPct(relativePosition)
                    .build());

            previousRate = rate;
        }
        return points;
    }

    private static double percentChange(double from, double to) {
        if (from == 0.0) {
            return 0.0;
        }
        return (to / from - 1) * 100;
    }
}
