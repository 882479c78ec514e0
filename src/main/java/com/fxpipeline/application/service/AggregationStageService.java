package com.fxpipeline.application.service;

import com.fxpipeline.application.port.in.AggregationStageUseCase;
import com.fxpipeline.application.port.in.PipelineStage;
import com.fxpipeline.application.port.in.ProcessingReport;
import com.fxpipeline.application.port.out.AnalyticsRepository;
import com.fxpipeline.application.port.out.ValidatedRateRepository;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.model.AnalyticsDataset;
import com.fxpipeline.domain.model.CurrencySummary;
import com.fxpipeline.domain.model.DailyMetric;
import com.fxpipeline.domain.model.MarketOverview;
import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.model.TrendPoint;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregation run: validated tables of a trailing window in, analytical tables and overview out.
 * Days without data are skipped with a warning; a window without any data fails the run.
 */
@Slf4j
@RequiredArgsConstructor
public class AggregationStageService implements AggregationStageUseCase {

    static final int TOP_CURRENCIES = 5;

    private final ValidatedRateRepository validatedRepository;
    private final AnalyticsRepository analyticsRepository;
    private final DailyAggregator dailyAggregator;
    private final TrendCalculator trendCalculator;
    private final CurrencySummarizer summarizer;
    private final MarketOverviewBuilder overviewBuilder;

    @Override
    public Future<ProcessingReport> process(LocalDate targetDate, int windowDays) {
        StageTimer timer = StageTimer.start();
        log.info("=== Starting aggregation stage: date={}, windowDays={} ===", targetDate, windowDays);

        if (!AggregationStageUseCase.isValidWindow(windowDays)) {
            return Future.succeededFuture(failed(targetDate, timer, PipelineException.inputError(
                    "Window must cover 1 to " + MAX_WINDOW_DAYS + " days, got " + windowDays)));
        }

        LocalDate startDate = targetDate.minusDays(windowDays - 1L);
        WindowData window = new WindowData(startDate, targetDate);

        return loadWindow(window)
                .map(this::aggregate)
                .compose(dataset -> analyticsRepository.saveAll(targetDate, dataset)
                        .map(files -> succeeded(targetDate, timer, window, dataset, files)))
                .otherwise(error -> failed(targetDate, timer, error));
    }

    private Future<WindowData> loadWindow(WindowData window) {
        Future<Void> chain = Future.succeededFuture();
        for (LocalDate date = window.start; !date.isAfter(window.end); date = date.plusDays(1)) {
            LocalDate day = date;
            chain = chain.compose(v -> validatedRepository.load(day)
                    .onSuccess(loaded -> {
                        if (loaded.isPresent()) {
                            log.debug("Loaded {} validated records for {}", loaded.get().size(), day);
                            window.add(day, loaded.get());
                        } else {
                            log.warn("No validated data for {}, skipping", day);
                        }
                    })
                    .mapEmpty());
        }
        return chain.map(v -> {
            if (window.daysWithData.isEmpty()) {
                throw new PipelineException(ErrorCategory.NO_DATA_FOR_PERIOD,
                        "No data found for period " + window.start + " to " + window.end);
            }
            log.info("Validated data loaded: records={}, days={}", window.observations.size(), window.daysWithData.size());
            return window;
        });
    }

    private AnalyticsDataset aggregate(WindowData window) {
        List<DailyMetric> dailyMetrics = dailyAggregator.aggregate(window.observations);
        List<TrendPoint> trends = trendCalculator.calculate(dailyMetrics);
        List<CurrencySummary> summaries = summarizer.summarize(trends);
        MarketOverview overview = overviewBuilder.build(summaries);
        return new AnalyticsDataset(dailyMetrics, trends, summaries, overview);
    }

    private ProcessingReport succeeded(LocalDate targetDate, StageTimer timer, WindowData window,
                                       AnalyticsDataset dataset, Map<String, String> files) {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("period_analyzed", window.start + " to " + window.end);
        counters.put("days_included", window.daysWithData.size());
        counters.put("silver_records_processed", window.observations.size());
        counters.put("daily_metrics_calculated", dataset.dailyMetrics().size());
        counters.put("currencies_analyzed", dataset.summaries().size());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("market_overview", dataset.overview());
        details.put("top_currencies", dataset.summaries().stream()
                .limit(TOP_CURRENCIES)
                .map(summary -> Map.of(
                        "currency", summary.getCurrency(),
                        "current_rate", summary.getCurrentRate(),
                        "trend_class", summary.getTrendClass().getValue()))
                .toList());

        double elapsed = timer.elapsedSeconds();
        log.info("=== Aggregation stage finished: date={}, currencies={}, files={}, seconds={} ===",
                targetDate, dataset.summaries().size(), files.size(), elapsed);
        return ProcessingReport.success(PipelineStage.AGGREGATE, targetDate, elapsed, counters, files, details);
    }

    private ProcessingReport failed(LocalDate targetDate, StageTimer timer, Throwable error) {
        log.error("=== Aggregation stage failed: date={}, category={}, error={} ===",
                targetDate, PipelineException.categoryOf(error), error.getMessage());
        return ProcessingReport.error(PipelineStage.AGGREGATE, targetDate, timer.elapsedSeconds(), error);
    }

    private static final class WindowData {
        private final LocalDate start;
        private final LocalDate end;
        private final List<LocalDate> daysWithData = new ArrayList<>();
        private final List<RateObservation> observations = new ArrayList<>();

        private WindowData(LocalDate start, LocalDate end) {
            this.start = start;
            this.end = end;
        }

        private void add(LocalDate date, List<RateObservation> dayObservations) {
            daysWithData.add(date);
            observations.addAll(dayObservations);
        }
    }
}
