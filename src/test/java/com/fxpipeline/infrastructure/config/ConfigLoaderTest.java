package com.fxpipeline.infrastructure.config;

import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader and PipelineConfig binding
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testClasspathDefaults() {
        PipelineConfig config = PipelineConfig.fromJson(new ConfigLoader(name -> null).load(null));

        assertEquals(8080, config.getHttpPort());
        assertEquals(Path.of("data"), config.getBasePath());
        assertEquals(PipelineConfig.DEFAULT_BASE_URL, config.getApi().getBaseUrl());
        assertEquals("", config.getApi().getApiKey());
        assertEquals(30_000, config.getApi().getTimeoutMs());
        assertEquals(3, config.getApi().getRetryAttempts());
        assertEquals(5_000L, config.getApi().getRetryDelayMs());
        assertEquals("USD", config.getBaseCurrency());
        assertEquals("1.0.0", config.getPipelineVersion());
        assertEquals(30, config.getWindowDays());
        assertFalse(config.isStrictCurrencyCodes());
    }

    @Test
    void testEnvironmentOverridesApiKey() {
        Map<String, String> environment = Map.of("EXCHANGE_API_KEY", "from-env");

        JsonObject config = new ConfigLoader(environment::get).load(null);

        assertEquals("from-env", PipelineConfig.fromJson(config).getApi().getApiKey());
    }

    @Test
    void testExplicitFile() throws Exception {
        Path file = tempDir.resolve("pipeline.yml");
        Files.writeString(file, String.join("\n",
                "data:",
                "  base-path: /var/lib/fx",
                "pipeline:",
                "  base-currency: EUR",
                "  window-days: 7",
                "validation:",
                "  strict-currency-codes: true",
                ""));

        PipelineConfig config = PipelineConfig.fromJson(new ConfigLoader(name -> null).load(file));

        assertEquals(Path.of("/var/lib/fx"), config.getBasePath());
        assertEquals("EUR", config.getBaseCurrency());
        assertEquals(7, config.getWindowDays());
        assertTrue(config.isStrictCurrencyCodes());
        assertEquals(3, config.getApi().getRetryAttempts(), "Absent keys fall back to defaults");
    }

    @Test
    void testMissingFile() {
        PipelineException error = assertThrows(PipelineException.class,
                () -> new ConfigLoader(name -> null).load(tempDir.resolve("absent.yml")));
        assertEquals(ErrorCategory.CONFIGURATION_ERROR, error.getCategory());
    }

    @Test
    void testInvalidValues() {
        JsonObject config = new JsonObject().put("pipeline", new JsonObject().put("window-days", 0));
        PipelineException error = assertThrows(PipelineException.class, () -> PipelineConfig.fromJson(config));
        assertEquals(ErrorCategory.CONFIGURATION_ERROR, error.getCategory());

        JsonObject tooLong = new JsonObject().put("pipeline", new JsonObject().put("window-days", 366));
        error = assertThrows(PipelineException.class, () -> PipelineConfig.fromJson(tooLong));
        assertEquals(ErrorCategory.CONFIGURATION_ERROR, error.getCategory());

        JsonObject wrongType = new JsonObject().put("http", new JsonObject().put("port", "eighty"));
        assertThrows(PipelineException.class, () -> PipelineConfig.fromJson(wrongType));
    }
}
