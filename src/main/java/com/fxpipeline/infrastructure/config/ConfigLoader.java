package com.fxpipeline.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads application.yml into a JsonObject.
 * Reads the classpath copy unless an explicit file is given; EXCHANGE_API_KEY overrides api.key.
 */
@Slf4j
public class ConfigLoader {

    static final String DEFAULT_RESOURCE = "application.yml";
    static final String API_KEY_ENV = "EXCHANGE_API_KEY";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Function<String, String> environment;

    public ConfigLoader() {
        this(System::getenv);
    }

    ConfigLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    public JsonObject load(Path configFile) {
        JsonObject config = configFile != null ? readFile(configFile) : readClasspath();
        applyEnvironment(config);
        return config;
    }

    private JsonObject readClasspath() {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new PipelineException(ErrorCategory.CONFIGURATION_ERROR, DEFAULT_RESOURCE + " not found in classpath");
            }
            JsonObject config = parse(is.readAllBytes());
            log.info("Loaded configuration from classpath {}", DEFAULT_RESOURCE);
            return config;
        } catch (IOException e) {
            throw new PipelineException(ErrorCategory.CONFIGURATION_ERROR, "Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    private JsonObject readFile(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new PipelineException(ErrorCategory.CONFIGURATION_ERROR, "Configuration file not found: " + configFile);
        }
        try {
            JsonObject config = parse(Files.readAllBytes(configFile));
            log.info("Loaded configuration from {}", configFile);
            return config;
        } catch (IOException e) {
            throw new PipelineException(ErrorCategory.CONFIGURATION_ERROR, "Failed to read " + configFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private JsonObject parse(byte[] yaml) throws IOException {
        Map<String, Object> tree = yamlMapper.readValue(yaml, Map.class);
        return tree != null ? new JsonObject(tree) : new JsonObject();
    }

    private void applyEnvironment(JsonObject config) {
        String apiKey = environment.apply(API_KEY_ENV);
        if (apiKey != null && !apiKey.isBlank()) {
            JsonObject api = config.getJsonObject("api");
            if (api == null) {
                api = new JsonObject();
                config.put("api", api);
            }
            api.put("key", apiKey);
            log.debug("API key taken from {}", API_KEY_ENV);
        }
    }
}
