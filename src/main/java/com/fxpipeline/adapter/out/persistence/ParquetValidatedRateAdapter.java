package com.fxpipeline.adapter.out.persistence;

import com.fxpipeline.application.port.out.ValidatedRateRepository;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.model.RateObservation;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Parquet persistence adapter for validated observations.
 * Layout: {basePath}/silver/exchange_rates_YYYY-MM-DD.parquet
 */
@Slf4j
public class ParquetValidatedRateAdapter implements ValidatedRateRepository {

    static final String DIRECTORY = "silver";

    private final Vertx vertx;
    private final Path directory;

    public ParquetValidatedRateAdapter(Vertx vertx, Path basePath) {
        this.vertx = vertx;
        this.directory = basePath.resolve(DIRECTORY);
    }

    @Override
    public Future<String> save(LocalDate date, List<RateObservation> observations) {
        String fileName = fileName(date);
        return vertx.executeBlocking(() -> {
            try (StagedFiles files = new StagedFiles(directory)) {
                ParquetFiles.write(files.stage(fileName), ParquetTables.RATE_OBSERVATIONS, observations);
                Path path = files.commit().get(fileName);
                log.info("Saved {} validated observations to {}", observations.size(), path);
                return path.toString();
            } catch (IOException | RuntimeException e) {
                throw PipelineException.storageError("Failed to write validated data for " + date, e);
            }
        });
    }

    @Override
    public Future<Optional<List<RateObservation>>> load(LocalDate date) {
        Path path = directory.resolve(fileName(date));
        return vertx.executeBlocking(() -> {
            if (!Files.exists(path)) {
                log.debug("No validated data at {}", path);
                return Optional.empty();
            }
            try {
                List<RateObservation> observations = ParquetFiles.read(path, ParquetTables.RATE_OBSERVATIONS);
                log.debug("Loaded {} validated observations from {}", observations.size(), path);
                return Optional.of(observations);
            } catch (IOException | RuntimeException e) {
                throw PipelineException.storageError("Failed to read validated data from " + path, e);
            }
        });
    }

    static String fileName(LocalDate date) {
        return "exchange_rates_" + date + ".parquet";
    }
}
