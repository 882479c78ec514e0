package com.fxpipeline.adapter.out.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxpipeline.application.port.out.AnalyticsRepository;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.model.AnalyticsDataset;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence adapter for the aggregated layer under {basePath}/gold.
 * The five artifacts of one run are published together or not at all.
 */
@Slf4j
public class FileAnalyticsAdapter implements AnalyticsRepository {

    static final String DIRECTORY = "gold";

    public static final String DAILY_METRICS = "daily_metrics";
    public static final String HISTORICAL_TRENDS = "historical_trends";
    public static final String CURRENCY_SUMMARY = "currency_summary";
    public static final String MARKET_OVERVIEW = "market_overview";
    public static final String CONSOLIDATED = "consolidated";

    private final Vertx vertx;
    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileAnalyticsAdapter(Vertx vertx, Path basePath, ObjectMapper objectMapper) {
        this.vertx = vertx;
        this.directory = basePath.resolve(DIRECTORY);
        this.objectMapper = objectMapper;
    }

    @Override
    public Future<Map<String, String>> saveAll(LocalDate date, AnalyticsDataset dataset) {
        return vertx.executeBlocking(() -> {
            try (StagedFiles files = new StagedFiles(directory)) {
                ParquetFiles.write(files.stage(parquetName(DAILY_METRICS, date)),
                        ParquetTables.DAILY_METRICS, dataset.dailyMetrics());
                ParquetFiles.write(files.stage(parquetName(HISTORICAL_TRENDS, date)),
                        ParquetTables.TRENDS, dataset.trends());
                ParquetFiles.write(files.stage(parquetName(CURRENCY_SUMMARY, date)),
                        ParquetTables.CURRENCY_SUMMARIES, dataset.summaries());
                objectMapper.writeValue(files.stage(jsonName(MARKET_OVERVIEW, date)).toFile(), dataset.overview());
                ParquetFiles.write(files.stage(parquetName(CONSOLIDATED, date)),
                        ParquetTables.CONSOLIDATED,
                        dataset.summaries().stream().map(ConsolidatedRow::from).toList());

                Map<String, Path> published = files.commit();
                Map<String, String> outputs = new LinkedHashMap<>();
                outputs.put(DAILY_METRICS, published.get(parquetName(DAILY_METRICS, date)).toString());
                outputs.put(HISTORICAL_TRENDS, published.get(parquetName(HISTORICAL_TRENDS, date)).toString());
                outputs.put(CURRENCY_SUMMARY, published.get(parquetName(CURRENCY_SUMMARY, date)).toString());
                outputs.put(MARKET_OVERVIEW, published.get(jsonName(MARKET_OVERVIEW, date)).toString());
                outputs.put(CONSOLIDATED, published.get(parquetName(CONSOLIDATED, date)).toString());
                log.info("Saved {} aggregated artifacts for {} to {}", outputs.size(), date, directory);
                return outputs;
            } catch (IOException | RuntimeException e) {
                throw PipelineException.storageError("Failed to write aggregated data for " + date, e);
            }
        });
    }

    @Override
    public Future<Optional<JsonObject>> loadOverview(LocalDate date) {
        Path path = directory.resolve(jsonName(MARKET_OVERVIEW, date));
        return vertx.executeBlocking(() -> {
            if (!Files.exists(path)) {
                return Optional.empty();
            }
            try {
                return Optional.of(new JsonObject(Files.readString(path)));
            } catch (IOException | RuntimeException e) {
                throw PipelineException.storageError("Failed to read market overview " + path, e);
            }
        });
    }

    static String parquetName(String artifact, LocalDate date) {
        return artifact + "_" + date + ".parquet";
    }

    static String jsonName(String artifact, LocalDate date) {
        return artifact + "_" + date + ".json";
    }
}
