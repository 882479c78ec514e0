package com.fxpipeline.adapter.out.persistence;

import com.fxpipeline.TestData;
import com.fxpipeline.application.service.CurrencySummarizer;
import com.fxpipeline.application.service.DailyAggregator;
import com.fxpipeline.application.service.MarketOverviewBuilder;
import com.fxpipeline.application.service.TrendCalculator;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.model.AnalyticsDataset;
import com.fxpipeline.domain.model.CurrencySummary;
import com.fxpipeline.domain.model.DailyMetric;
import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.model.TrendPoint;
import com.fxpipeline.infrastructure.config.JsonMappers;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static com.fxpipeline.TestFutures.await;
import static com.fxpipeline.TestFutures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileAnalyticsAdapter against a temporary directory
 */
class FileAnalyticsAdapterTest {

    @TempDir
    Path basePath;

    private Vertx vertx;
    private FileAnalyticsAdapter adapter;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        adapter = new FileAnalyticsAdapter(vertx, basePath, JsonMappers.pretty());
    }

    @AfterEach
    void tearDown() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    @Test
    void testSaveAllPublishesEveryArtifact() throws Exception {
        AnalyticsDataset dataset = dataset();

        Map<String, String> outputs = await(adapter.saveAll(TestData.DATE, dataset));

        assertEquals(List.of("daily_metrics", "historical_trends", "currency_summary", "market_overview", "consolidated"),
                List.copyOf(outputs.keySet()));
        outputs.values().forEach(location -> assertTrue(Files.exists(Path.of(location)), location));
        assertEquals(List.of(
                "consolidated_2024-03-15.parquet",
                "currency_summary_2024-03-15.parquet",
                "daily_metrics_2024-03-15.parquet",
                "historical_trends_2024-03-15.parquet",
                "market_overview_2024-03-15.json"), filesIn(basePath.resolve("gold")));
    }

    @Test
    void testTablesReadBackUnchanged() throws Exception {
        AnalyticsDataset dataset = dataset();
        Map<String, String> outputs = await(adapter.saveAll(TestData.DATE, dataset));

        List<DailyMetric> metrics = ParquetFiles.read(Path.of(outputs.get("daily_metrics")), ParquetTables.DAILY_METRICS);
        List<TrendPoint> trends = ParquetFiles.read(Path.of(outputs.get("historical_trends")), ParquetTables.TRENDS);
        List<CurrencySummary> summaries =
                ParquetFiles.read(Path.of(outputs.get("currency_summary")), ParquetTables.CURRENCY_SUMMARIES);
        List<ConsolidatedRow> consolidated =
                ParquetFiles.read(Path.of(outputs.get("consolidated")), ParquetTables.CONSOLIDATED);

        assertEquals(dataset.dailyMetrics(), metrics);
        assertEquals(dataset.trends(), trends);
        assertEquals(dataset.summaries(), summaries);
        assertEquals(dataset.summaries().size(), consolidated.size());
        assertEquals(dataset.summaries().get(0).getCurrency(), consolidated.get(0).currency());
    }

    @Test
    void testLoadOverview() throws Exception {
        await(adapter.saveAll(TestData.DATE, dataset()));

        Optional<JsonObject> overview = await(adapter.loadOverview(TestData.DATE));

        assertTrue(overview.isPresent());
        assertEquals(2, overview.get().getInteger("total_currencies"));
        assertEquals("2024-03-13", overview.get().getJsonObject("observation_period").getString("start"));
        assertTrue(await(adapter.loadOverview(TestData.DATE.plusDays(1))).isEmpty());
    }

    @Test
    void testFailedWriteLeavesNothingBehind() throws Exception {
        AnalyticsDataset complete = dataset();
        List<CurrencySummary> broken = new ArrayList<>(complete.summaries());
        broken.set(0, broken.get(0).toBuilder().trendClass(null).build());
        AnalyticsDataset dataset = new AnalyticsDataset(complete.dailyMetrics(), complete.trends(), broken, complete.overview());

        Throwable error = awaitFailure(adapter.saveAll(TestData.DATE, dataset));

        assertEquals(ErrorCategory.STORAGE_ERROR, PipelineException.categoryOf(error));
        assertEquals(List.of(), filesIn(basePath.resolve("gold")));
    }

    private static AnalyticsDataset dataset() {
        List<RateObservation> observations = new ArrayList<>();
        for (int day = 0; day < 3; day++) {
            LocalDateTime collectedAt = TestData.DATE.minusDays(2 - day).atTime(6, 0, 0, 250_000);
            observations.add(TestData.observation("USD", "EUR", 0.90 + day * 0.01, collectedAt));
            observations.add(TestData.observation("USD", "BRL", 5.50 - day * 0.05, collectedAt));
        }
        List<DailyMetric> metrics = new DailyAggregator().aggregate(observations);
        List<TrendPoint> trends = new TrendCalculator().calculate(metrics);
        List<CurrencySummary> summaries = new CurrencySummarizer().summarize(trends);
        return new AnalyticsDataset(metrics, trends, summaries, new MarketOverviewBuilder().build(summaries));
    }

    private static List<String> filesIn(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }
}
