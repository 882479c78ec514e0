package com.fxpipeline.infrastructure.config;

import com.fxpipeline.adapter.out.http.ExchangeRateApiAdapter;
import com.fxpipeline.adapter.out.persistence.FileAnalyticsAdapter;
import com.fxpipeline.adapter.out.persistence.JsonRawSnapshotAdapter;
import com.fxpipeline.adapter.out.persistence.ParquetValidatedRateAdapter;
import com.fxpipeline.application.port.out.AnalyticsRepository;
import com.fxpipeline.application.port.out.ExchangeRateProvider;
import com.fxpipeline.application.port.out.RawSnapshotRepository;
import com.fxpipeline.application.port.out.ValidatedRateRepository;
import com.fxpipeline.application.service.AggregationStageService;
import com.fxpipeline.application.service.CurrencySummarizer;
import com.fxpipeline.application.service.DailyAggregator;
import com.fxpipeline.application.service.MarketOverviewBuilder;
import com.fxpipeline.application.service.PipelineRunner;
import com.fxpipeline.application.service.QualityScorer;
import com.fxpipeline.application.service.RateIngestionService;
import com.fxpipeline.application.service.RecordNormalizer;
import com.fxpipeline.application.service.RecordValidator;
import com.fxpipeline.application.service.SnapshotParser;
import com.fxpipeline.application.service.TrendCalculator;
import com.fxpipeline.application.service.ValidationStageService;
import io.vertx.core.Vertx;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Wires adapters and services for one configuration.
 */
@Slf4j
@Getter
public class PipelineModule {

    private final PipelineConfig config;
    private final RawSnapshotRepository rawRepository;
    private final ValidatedRateRepository validatedRepository;
    private final AnalyticsRepository analyticsRepository;
    private final PipelineRunner runner;

    public PipelineModule(Vertx vertx, PipelineConfig config, Clock clock) {
        this(vertx, config, clock, new ExchangeRateApiAdapter(vertx, config.getApi()));
    }

    public PipelineModule(Vertx vertx, PipelineConfig config, Clock clock, ExchangeRateProvider rateProvider) {
        this.config = config;

        // Output ports (adapters)
        this.rawRepository = new JsonRawSnapshotAdapter(vertx, config.getBasePath());
        this.validatedRepository = new ParquetValidatedRateAdapter(vertx, config.getBasePath());
        this.analyticsRepository = new FileAnalyticsAdapter(vertx, config.getBasePath(), JsonMappers.pretty());

        // Application services (use cases)
        RateIngestionService ingestion = new RateIngestionService(
                rateProvider, rawRepository, config.getPipelineVersion(), clock);
        ValidationStageService validation = new ValidationStageService(
                rawRepository,
                validatedRepository,
                new SnapshotParser(),
                new RecordNormalizer(),
                new RecordValidator(config.isStrictCurrencyCodes()),
                new QualityScorer());
        AggregationStageService aggregation = new AggregationStageService(
                validatedRepository,
                analyticsRepository,
                new DailyAggregator(),
                new TrendCalculator(),
                new CurrencySummarizer(),
                new MarketOverviewBuilder(clock));

        this.runner = new PipelineRunner(ingestion, validation, aggregation);
        log.info("Pipeline wired: basePath={}, baseCurrency={}", config.getBasePath(), config.getBaseCurrency());
    }
}
