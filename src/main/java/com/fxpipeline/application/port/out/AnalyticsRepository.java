package com.fxpipeline.application.port.out;

import com.fxpipeline.domain.model.AnalyticsDataset;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Output port for the aggregated layer.
 */
public interface AnalyticsRepository {

    /**
     * Persist every artifact of the dataset, all or nothing.
     * @return artifact name to stored location
     */
    Future<Map<String, String>> saveAll(LocalDate date, AnalyticsDataset dataset);

    Future<Optional<JsonObject>> loadOverview(LocalDate date);
}
