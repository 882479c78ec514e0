package com.fxpipeline.application.service;

import com.fxpipeline.application.port.in.PipelineStage;
import com.fxpipeline.application.port.in.ProcessingReport;
import com.fxpipeline.application.port.in.RateIngestionUseCase;
import com.fxpipeline.application.port.out.ExchangeRateProvider;
import com.fxpipeline.application.port.out.RawSnapshotRepository;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.rule.CurrencyCodeRule;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches the latest snapshot and stores it, wrapped with pipeline metadata, in the raw layer.
 */
@Slf4j
public class RateIngestionService implements RateIngestionUseCase {

    private final ExchangeRateProvider rateProvider;
    private final RawSnapshotRepository rawRepository;
    private final String pipelineVersion;
    private final Clock clock;

    public RateIngestionService(ExchangeRateProvider rateProvider, RawSnapshotRepository rawRepository,
                                String pipelineVersion, Clock clock) {
        this.rateProvider = rateProvider;
        this.rawRepository = rawRepository;
        this.pipelineVersion = pipelineVersion;
        this.clock = clock;
    }

    @Override
    public Future<ProcessingReport> ingest(LocalDate targetDate, String baseCurrency) {
        StageTimer timer = StageTimer.start();
        log.info("=== Starting ingestion: date={}, base={} ===", targetDate, baseCurrency);

        if (!CurrencyCodeRule.isWellFormed(baseCurrency)) {
            return Future.succeededFuture(failed(targetDate, timer,
                    PipelineException.inputError("Invalid base currency code: " + baseCurrency)));
        }
        String base = CurrencyCodeRule.normalize(baseCurrency);
        LocalDateTime collectedAt = LocalDateTime.now(clock);
        if (!collectedAt.toLocalDate().equals(targetDate)) {
            // The provider only serves the latest rates; they belong to the collection day
            return Future.succeededFuture(failed(targetDate, timer, PipelineException.inputError(
                    "Cannot ingest rates for " + targetDate + ": latest rates are collected on "
                            + collectedAt.toLocalDate())));
        }

        return rateProvider.fetchLatestRates(base)
                .compose(response -> {
                    JsonObject document = wrap(response, collectedAt, targetDate, base);
                    int ratesCollected = response.getJsonObject(SnapshotParser.CONVERSION_RATES, new JsonObject()).size();
                    return rawRepository.save(targetDate, document)
                            .map(location -> succeeded(targetDate, timer, base, ratesCollected, location));
                })
                .otherwise(error -> failed(targetDate, timer, error));
    }

    private JsonObject wrap(JsonObject response, LocalDateTime collectedAt, LocalDate targetDate, String base) {
        JsonObject metadata = new JsonObject()
                .put(SnapshotParser.COLLECTION_TIMESTAMP, collectedAt.toString())
                .put(SnapshotParser.COLLECTION_DATE, targetDate.toString())
                .put(SnapshotParser.BASE_CURRENCY, base)
                .put(SnapshotParser.PIPELINE_VERSION, pipelineVersion);
        return new JsonObject()
                .put(SnapshotParser.PIPELINE_METADATA, metadata)
                .put(SnapshotParser.API_RESPONSE, response);
    }

    private ProcessingReport succeeded(LocalDate targetDate, StageTimer timer, String base,
                                       int ratesCollected, String location) {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("base_currency", base);
        counters.put("rates_collected", ratesCollected);

        double elapsed = timer.elapsedSeconds();
        log.info("=== Ingestion finished: date={}, rates={}, file={}, seconds={} ===",
                targetDate, ratesCollected, location, elapsed);
        return ProcessingReport.success(PipelineStage.INGEST, targetDate, elapsed,
                counters, Map.of("raw_file", location), null);
    }

    private ProcessingReport failed(LocalDate targetDate, StageTimer timer, Throwable error) {
        log.error("=== Ingestion failed: date={}, category={}, error={} ===",
                targetDate, PipelineException.categoryOf(error), error.getMessage());
        return ProcessingReport.error(PipelineStage.INGEST, targetDate, timer.elapsedSeconds(), error);
    }
}
