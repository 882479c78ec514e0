package com.fxpipeline.adapter.out.http;

import com.fxpipeline.application.port.out.ExchangeRateProvider;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.infrastructure.config.PipelineConfig.ApiSettings;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP adapter for the exchange-rate API.
 * GET {baseUrl}/{apiKey}/latest/{BASE}, retried with a fixed delay on transport,
 * server and payload errors. Client errors (4xx) are not retried.
 */
@Slf4j
public class ExchangeRateApiAdapter implements ExchangeRateProvider {

    private static final String USER_AGENT = "fx-rate-pipeline/1.0";
    private static final String MASK = "***";

    private final Vertx vertx;
    private final WebClient webClient;
    private final ApiSettings settings;

    public ExchangeRateApiAdapter(Vertx vertx, ApiSettings settings) {
        this(vertx, WebClient.create(vertx, new WebClientOptions().setUserAgent(USER_AGENT)), settings);
    }

    ExchangeRateApiAdapter(Vertx vertx, WebClient webClient, ApiSettings settings) {
        this.vertx = vertx;
        this.webClient = webClient;
        this.settings = settings;
    }

    @Override
    public Future<JsonObject> fetchLatestRates(String baseCurrency) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            return Future.failedFuture(new PipelineException(ErrorCategory.CONFIGURATION_ERROR,
                    "API key is not configured (set api.key or EXCHANGE_API_KEY)"));
        }
        log.info("Fetching latest rates for {} from {}", baseCurrency, maskedUrl(baseCurrency));
        return attempt(baseCurrency, 1);
    }

    private Future<JsonObject> attempt(String baseCurrency, int attempt) {
        return webClient.getAbs(url(baseCurrency, settings.getApiKey()))
                .timeout(settings.getTimeoutMs())
                .putHeader("Accept", "application/json")
                .send()
                .compose(response -> handleResponse(response, baseCurrency))
                .recover(error -> retryOrFail(error, baseCurrency, attempt));
    }

    private Future<JsonObject> handleResponse(HttpResponse<Buffer> response, String baseCurrency) {
        int status = response.statusCode();
        if (status >= 400 && status < 500) {
            return Future.failedFuture(new ClientErrorException(
                    "Rate API rejected request for " + baseCurrency + " with HTTP " + status));
        }
        if (status != 200) {
            return Future.failedFuture(PipelineException.upstreamError("Rate API returned HTTP " + status));
        }
        try {
            return Future.succeededFuture(checkPayload(response.bodyAsJsonObject()));
        } catch (DecodeException e) {
            return Future.failedFuture(PipelineException.upstreamError("Rate API returned malformed JSON: " + e.getMessage()));
        } catch (PipelineException e) {
            return Future.failedFuture(e);
        }
    }

    /**
     * Response must report success and carry a base code and a non-empty rate table.
     */
    static JsonObject checkPayload(JsonObject body) {
        if (body == null) {
            throw PipelineException.upstreamError("Rate API returned an empty body");
        }
        if (!"success".equals(body.getValue("result"))) {
            Object reason = body.containsKey("error-type") ? body.getValue("error-type") : body.getValue("result");
            throw PipelineException.upstreamError("Rate API reported failure: " + reason);
        }
        if (!(body.getValue("base_code") instanceof String)) {
            throw PipelineException.upstreamError("Rate API response is missing base_code");
        }
        Object rates = body.getValue("conversion_rates");
        if (!(rates instanceof JsonObject) || ((JsonObject) rates).isEmpty()) {
            throw PipelineException.upstreamError("Rate API response has no conversion_rates");
        }
        return body;
    }

    private Future<JsonObject> retryOrFail(Throwable error, String baseCurrency, int attempt) {
        if (error instanceof ClientErrorException) {
            log.error("{}; not retrying", error.getMessage());
            return Future.failedFuture(error);
        }
        int maxAttempts = Math.max(1, settings.getRetryAttempts());
        log.warn("Attempt {}/{} to fetch rates for {} failed: {}", attempt, maxAttempts, baseCurrency, error.getMessage());
        if (attempt >= maxAttempts) {
            return Future.failedFuture(new PipelineException(ErrorCategory.UPSTREAM_ERROR,
                    "Failed to fetch rates for " + baseCurrency + " after " + maxAttempts + " attempts: "
                            + error.getMessage(), error));
        }
        return delay(settings.getRetryDelayMs())
                .compose(v -> attempt(baseCurrency, attempt + 1));
    }

    private Future<Void> delay(long millis) {
        if (millis <= 0) {
            return Future.succeededFuture();
        }
        Promise<Void> promise = Promise.promise();
        vertx.setTimer(millis, id -> promise.complete());
        return promise.future();
    }

    private String url(String baseCurrency, String key) {
        String baseUrl = settings.getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + "/" + key + "/latest/" + baseCurrency;
    }

    String maskedUrl(String baseCurrency) {
        return url(baseCurrency, MASK);
    }

    /**
     * Upstream refused the request; repeating it would not help.
     */
    static final class ClientErrorException extends PipelineException {
        ClientErrorException(String message) {
            super(ErrorCategory.UPSTREAM_ERROR, message);
        }
    }
}
