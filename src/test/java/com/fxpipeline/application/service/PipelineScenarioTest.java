package com.fxpipeline.application.service;

import com.fxpipeline.TestData;
import com.fxpipeline.domain.model.CurrencySummary;
import com.fxpipeline.domain.model.DailyMetric;
import com.fxpipeline.domain.model.MarketOverview;
import com.fxpipeline.domain.model.QualityReport;
import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.model.TrendClass;
import com.fxpipeline.domain.model.TrendPoint;
import com.fxpipeline.domain.model.ValidationOutcome;
import com.fxpipeline.domain.model.VolatilityClass;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One snapshot carried through every pure step of the pipeline.
 */
class PipelineScenarioTest {

    private final SnapshotParser parser = new SnapshotParser();
    private final RecordNormalizer normalizer = new RecordNormalizer();
    private final RecordValidator validator = new RecordValidator();
    private final QualityScorer scorer = new QualityScorer();
    private final DailyAggregator aggregator = new DailyAggregator();
    private final TrendCalculator trendCalculator = new TrendCalculator();
    private final CurrencySummarizer summarizer = new CurrencySummarizer();
    private final MarketOverviewBuilder overviewBuilder = new MarketOverviewBuilder();

    @Test
    void testCleanSnapshotFlowsThroughAllSteps() {
        JsonObject raw = TestData.rawDocument("USD", new JsonObject().put("BRL", 5.50).put("EUR", 0.90));

        List<RateObservation> records = normalizer.normalize(parser.parse(raw, TestData.DATE));
        assertEquals(2, records.size());

        ValidationOutcome outcome = validator.validate(records);
        assertEquals(2, outcome.accepted().size());

        QualityReport quality = scorer.assess(outcome.accepted());
        assertEquals(1.0, quality.overallScore());

        List<DailyMetric> metrics = aggregator.aggregate(outcome.accepted());
        assertEquals(2, metrics.size());
        metrics.forEach(metric -> {
            assertEquals(1, metric.getObservationCount());
            assertEquals(0.0, metric.getRateStd());
        });

        List<TrendPoint> trends = trendCalculator.calculate(metrics);
        trends.forEach(point -> {
            assertEquals(0.0, point.getDailyChangePct());
            assertEquals(point.getRateMean(), point.getMovingAvg7d());
            assertEquals(50.0, point.getRelativePositionPct());
        });

        List<CurrencySummary> summaries = summarizer.summarize(trends);
        summaries.forEach(summary -> {
            assertEquals(TrendClass.STABLE, summary.getTrendClass());
            assertEquals(VolatilityClass.LOW, summary.getVolatilityClass());
        });

        MarketOverview overview = overviewBuilder.build(summaries);
        assertEquals(2, overview.getTotalCurrencies());
        assertEquals(2, overview.getMarketSentiment().currenciesStable());
        assertEquals(2, overview.getVolatilityDistribution().low());
    }

    @Test
    void testNegativeRateIsRejectedAndLowersQuality() {
        JsonObject raw = TestData.rawDocument("USD", new JsonObject().put("BRL", 5.50).put("EUR", -5.0));

        List<RateObservation> records = normalizer.normalize(parser.parse(raw, TestData.DATE));
        ValidationOutcome outcome = validator.validate(records);

        assertEquals(1, outcome.accepted().size());
        assertEquals("BRL", outcome.accepted().get(0).getTargetCurrency());
        assertTrue(scorer.assess(records).overallScore() < 1.0);
    }
}
