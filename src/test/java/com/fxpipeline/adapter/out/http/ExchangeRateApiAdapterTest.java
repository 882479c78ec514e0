package com.fxpipeline.adapter.out.http;

import com.fxpipeline.TestData;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.infrastructure.config.PipelineConfig.ApiSettings;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.fxpipeline.TestFutures.await;
import static com.fxpipeline.TestFutures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExchangeRateApiAdapter against a local HTTP server
 */
class ExchangeRateApiAdapterTest {

    private static final String API_KEY = "secret-key";

    private Vertx vertx;
    private final AtomicInteger requests = new AtomicInteger();
    private final List<String> paths = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
    }

    @AfterEach
    void tearDown() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    @Test
    void fetchLatestRates_shouldReturnProviderPayload() throws Exception {
        JsonObject payload = TestData.apiResponse("USD", new JsonObject().put("EUR", 0.9));
        ExchangeRateApiAdapter adapter = adapterFor(request -> respond(request, 200, payload.encode()));

        JsonObject response = await(adapter.fetchLatestRates("USD"));

        assertEquals("USD", response.getString("base_code"));
        assertEquals(0.9, response.getJsonObject("conversion_rates").getDouble("EUR"));
        assertEquals(List.of("/" + API_KEY + "/latest/USD"), paths);
    }

    @Test
    void fetchLatestRates_shouldRetryServerErrors() throws Exception {
        JsonObject payload = TestData.apiResponse("USD", new JsonObject().put("EUR", 0.9));
        ExchangeRateApiAdapter adapter = adapterFor(request -> {
            if (requests.get() < 3) {
                respond(request, 503, "unavailable");
            } else {
                respond(request, 200, payload.encode());
            }
        });

        JsonObject response = await(adapter.fetchLatestRates("USD"));

        assertEquals("USD", response.getString("base_code"));
        assertEquals(3, requests.get());
    }

    @Test
    void fetchLatestRates_shouldGiveUpAfterConfiguredAttempts() throws Exception {
        ExchangeRateApiAdapter adapter = adapterFor(request -> respond(request, 500, "boom"));

        Throwable error = awaitFailure(adapter.fetchLatestRates("USD"));

        assertEquals(ErrorCategory.UPSTREAM_ERROR, PipelineException.categoryOf(error));
        assertTrue(error.getMessage().contains("after 3 attempts"), error.getMessage());
        assertEquals(3, requests.get());
    }

    @Test
    void fetchLatestRates_shouldNotRetryClientErrors() throws Exception {
        ExchangeRateApiAdapter adapter = adapterFor(request -> respond(request, 404, "{\"result\":\"error\"}"));

        Throwable error = awaitFailure(adapter.fetchLatestRates("XXX"));

        assertEquals(ErrorCategory.UPSTREAM_ERROR, PipelineException.categoryOf(error));
        assertTrue(error.getMessage().contains("HTTP 404"));
        assertEquals(1, requests.get());
    }

    @Test
    void fetchLatestRates_shouldRetryUnsuccessfulPayload() throws Exception {
        JsonObject failure = new JsonObject().put("result", "error").put("error-type", "quota-reached");
        ExchangeRateApiAdapter adapter = adapterFor(request -> respond(request, 200, failure.encode()));

        Throwable error = awaitFailure(adapter.fetchLatestRates("USD"));

        assertTrue(error.getMessage().contains("quota-reached"), error.getMessage());
        assertEquals(3, requests.get());
    }

    @Test
    void fetchLatestRates_shouldRequireApiKey() throws Exception {
        ApiSettings settings = settings("http://localhost:1").toBuilder().apiKey("").build();
        ExchangeRateApiAdapter adapter = new ExchangeRateApiAdapter(vertx, settings);

        Throwable error = awaitFailure(adapter.fetchLatestRates("USD"));

        assertEquals(ErrorCategory.CONFIGURATION_ERROR, PipelineException.categoryOf(error));
    }

    @Test
    void maskedUrl_shouldHideApiKey() {
        ExchangeRateApiAdapter adapter = new ExchangeRateApiAdapter(vertx, settings("https://rates.example/v6/"));

        String url = adapter.maskedUrl("USD");

        assertEquals("https://rates.example/v6/***/latest/USD", url);
        assertFalse(url.contains(API_KEY));
    }

    @Test
    void checkPayload_shouldRequireRates() {
        JsonObject empty = TestData.apiResponse("USD", new JsonObject());

        assertThrows(PipelineException.class, () -> ExchangeRateApiAdapter.checkPayload(empty));
        assertThrows(PipelineException.class, () -> ExchangeRateApiAdapter.checkPayload(empty.copy().put("conversion_rates", "none")));
    }

    private ExchangeRateApiAdapter adapterFor(Handler<HttpServerRequest> handler) throws InterruptedException {
        HttpServer server = await(vertx.createHttpServer()
                .requestHandler(request -> {
                    requests.incrementAndGet();
                    paths.add(request.path());
                    handler.handle(request);
                })
                .listen(0));
        return new ExchangeRateApiAdapter(vertx, settings("http://localhost:" + server.actualPort()));
    }

    private static ApiSettings settings(String baseUrl) {
        return ApiSettings.builder()
                .baseUrl(baseUrl)
                .apiKey(API_KEY)
                .timeoutMs(2_000)
                .retryAttempts(3)
                .retryDelayMs(10)
                .build();
    }

    private static void respond(HttpServerRequest request, int status, String body) {
        request.response()
                .setStatusCode(status)
                .putHeader("Content-Type", "application/json")
                .end(body);
    }
}
