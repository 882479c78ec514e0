package com.fxpipeline.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vertx.core.json.jackson.DatabindCodec;

/**
 * Jackson setup shared by file output and HTTP responses.
 * Dates and timestamps are written as ISO-8601 strings.
 */
public final class JsonMappers {

    private static final ObjectMapper MAPPER = configure(new ObjectMapper())
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonMappers() {
    }

    public static ObjectMapper pretty() {
        return MAPPER;
    }

    /**
     * Register java.time support on the mapper behind Vert.x JsonObject.mapFrom/mapTo.
     */
    public static void registerWithVertx() {
        configure(DatabindCodec.mapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
