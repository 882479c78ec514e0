package com.fxpipeline.infrastructure.config;

import com.fxpipeline.application.port.in.AggregationStageUseCase;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Immutable runtime settings bound from application.yml.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    public static final String DEFAULT_BASE_URL = "https://v6.exchangerate-api.com/v6";

    int httpPort;
    Path basePath;
    ApiSettings api;
    String baseCurrency;
    String pipelineVersion;
    int windowDays;
    boolean strictCurrencyCodes;

    @Value
    @Builder(toBuilder = true)
    public static class ApiSettings {
        String baseUrl;
        String apiKey;
        int timeoutMs;
        int retryAttempts;
        long retryDelayMs;
    }

    /**
     * Bind the nested configuration document, filling in defaults for absent keys.
     */
    public static PipelineConfig fromJson(JsonObject config) {
        JsonObject http = section(config, "http");
        JsonObject data = section(config, "data");
        JsonObject api = section(config, "api");
        JsonObject pipeline = section(config, "pipeline");
        JsonObject validation = section(config, "validation");

        try {
            PipelineConfig bound = PipelineConfig.builder()
                    .httpPort(http.getInteger("port", 8080))
                    .basePath(Path.of(data.getString("base-path", "data")))
                    .api(ApiSettings.builder()
                            .baseUrl(api.getString("base-url", DEFAULT_BASE_URL))
                            .apiKey(api.getString("key", ""))
                            .timeoutMs(api.getInteger("timeout-ms", 30_000))
                            .retryAttempts(api.getInteger("retry-attempts", 3))
                            .retryDelayMs(api.getLong("retry-delay-ms", 5_000L))
                            .build())
                    .baseCurrency(pipeline.getString("base-currency", "USD"))
                    .pipelineVersion(pipeline.containsKey("version") ? String.valueOf(pipeline.getValue("version")) : "1.0.0")
                    .windowDays(pipeline.getInteger("window-days", 30))
                    .strictCurrencyCodes(validation.getBoolean("strict-currency-codes", false))
                    .build();
            bound.check();
            return bound;
        } catch (ClassCastException e) {
            throw new PipelineException(ErrorCategory.CONFIGURATION_ERROR,
                    "Configuration value has the wrong type: " + e.getMessage(), e);
        }
    }

    private void check() {
        if (!AggregationStageUseCase.isValidWindow(windowDays)) {
            throw new PipelineException(ErrorCategory.CONFIGURATION_ERROR,
                    "pipeline.window-days must be between 1 and " + AggregationStageUseCase.MAX_WINDOW_DAYS);
        }
        if (api.getRetryAttempts() < 1) {
            throw new PipelineException(ErrorCategory.CONFIGURATION_ERROR, "api.retry-attempts must be at least 1");
        }
        if (api.getTimeoutMs() <= 0) {
            throw new PipelineException(ErrorCategory.CONFIGURATION_ERROR, "api.timeout-ms must be positive");
        }
    }

    private static JsonObject section(JsonObject config, String name) {
        JsonObject section = config.getJsonObject(name);
        return section != null ? section : new JsonObject();
    }
}
