package com.fxpipeline.application.service;

import com.fxpipeline.TestData;
import com.fxpipeline.domain.model.CurrencySummary;
import com.fxpipeline.domain.model.DailyMetric;
import com.fxpipeline.domain.model.TrendClass;
import com.fxpipeline.domain.model.TrendPoint;
import com.fxpipeline.domain.model.VolatilityClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CurrencySummarizer
 */
class CurrencySummarizerTest {

    private static final double DELTA = 1e-9;
    private static final LocalDate START = LocalDate.of(2024, 3, 1);

    private TrendCalculator trendCalculator;
    private CurrencySummarizer summarizer;

    @BeforeEach
    void setUp() {
        trendCalculator = new TrendCalculator();
        summarizer = new CurrencySummarizer();
    }

    @Test
    void testSummaryFields() {
        List<CurrencySummary> summaries = summarize(series("EUR", 1.0, 1.1, 1.21, 1.2));

        CurrencySummary eur = summaries.get(0);
        assertEquals("EUR", eur.getCurrency());
        assertEquals(1.2, eur.getCurrentRate(), DELTA);
        assertEquals(20.0, eur.getTotalChangePct(), DELTA);
        assertEquals((1.2 / 1.21 - 1) * 100, eur.getLastDailyChange(), DELTA);
        assertEquals(1.0, eur.getHistoricalMin(), DELTA);
        assertEquals(1.21, eur.getHistoricalMax(), DELTA);
        assertEquals((1.0 + 1.1 + 1.21 + 1.2) / 4, eur.getHistoricalAvg(), DELTA);
        assertEquals(10.0, eur.getMaxDailyGain(), DELTA);
        assertEquals(eur.getLastDailyChange(), eur.getMaxDailyDrop(), DELTA);
        assertEquals(START, eur.getFirstDate());
        assertEquals(START.plusDays(3), eur.getLastDate());
        assertEquals(4, eur.getTotalObservations());
        assertEquals(TrendClass.DOWN, eur.getTrendClass());
        assertEquals(VolatilityClass.HIGH, eur.getVolatilityClass());
    }

    @Test
    void testSinglePointIsStableAndLow() {
        CurrencySummary brl = summarize(series("BRL", 5.5)).get(0);

        assertEquals(TrendClass.STABLE, brl.getTrendClass());
        assertEquals(VolatilityClass.LOW, brl.getVolatilityClass());
        assertEquals(0.0, brl.getAvgDailyVolatility());
        assertEquals(1, brl.getTotalObservations());
    }

    @Test
    void testOrderingByObservationsThenVolatilityThenCode() {
        List<DailyMetric> metrics = new ArrayList<>();
        metrics.addAll(series("JPY", 150.0));
        metrics.addAll(series("GBP", 0.79, 0.85));
        metrics.addAll(series("EUR", 0.90, 0.90));
        metrics.addAll(series("CHF", 0.88, 0.88));

        List<CurrencySummary> summaries = summarize(metrics);

        assertEquals(List.of("CHF", "EUR", "GBP", "JPY"),
                summaries.stream().map(CurrencySummary::getCurrency).toList());
    }

    private List<CurrencySummary> summarize(List<DailyMetric> metrics) {
        List<TrendPoint> trends = trendCalculator.calculate(metrics);
        return summarizer.summarize(trends);
    }

    private static List<DailyMetric> series(String currency, double... rates) {
        List<DailyMetric> metrics = new ArrayList<>();
        for (int i = 0; i < rates.length; i++) {
            metrics.add(TestData.metric(START.plusDays(i), currency, rates[i]));
        }
        return metrics;
    }
}
