package com.fxpipeline.application.service;

import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.model.RateSnapshot;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Turns a stored raw snapshot document into a {@link RateSnapshot}.
 * Structural problems are input errors and fail the run.
 */
@Slf4j
public class SnapshotParser {

    public static final String PIPELINE_METADATA = "pipeline_metadata";
    public static final String API_RESPONSE = "api_response";
    public static final String COLLECTION_TIMESTAMP = "collection_timestamp";
    public static final String COLLECTION_DATE = "collection_date";
    public static final String BASE_CURRENCY = "base_currency";
    public static final String PIPELINE_VERSION = "pipeline_version";
    public static final String BASE_CODE = "base_code";
    public static final String CONVERSION_RATES = "conversion_rates";
    public static final String TIME_LAST_UPDATE_UNIX = "time_last_update_unix";

    private static final String UNKNOWN_VERSION = "unknown";

    public RateSnapshot parse(JsonObject document, LocalDate snapshotDate) {
        if (document == null) {
            throw PipelineException.inputError("Raw snapshot for " + snapshotDate + " is empty");
        }

        JsonObject metadata = requireObject(document, PIPELINE_METADATA, snapshotDate);
        JsonObject apiResponse = requireObject(document, API_RESPONSE, snapshotDate);

        String baseCurrency = apiResponse.getString(BASE_CODE);
        if (baseCurrency == null || baseCurrency.isBlank()) {
            throw PipelineException.inputError("Raw snapshot for " + snapshotDate + " has no " + BASE_CODE);
        }

        JsonObject conversionRates = requireObject(apiResponse, CONVERSION_RATES, snapshotDate);
        if (conversionRates.isEmpty()) {
            throw PipelineException.inputError("Raw snapshot for " + snapshotDate + " contains no rates");
        }

        LocalDateTime collectedAt = parseCollectionTimestamp(metadata, snapshotDate);
        checkCollectionDate(metadata, collectedAt, snapshotDate);
        LocalDateTime observedAt = parseLastUpdate(apiResponse, collectedAt);

        RateSnapshot.RateSnapshotBuilder builder = RateSnapshot.builder()
                .baseCurrency(baseCurrency)
                .collectedAt(collectedAt)
                .observedAt(observedAt)
                .snapshotDate(snapshotDate)
                .pipelineVersion(metadata.getString(PIPELINE_VERSION, UNKNOWN_VERSION));

        for (String target : conversionRates.fieldNames()) {
            builder.rate(target, toRate(conversionRates.getValue(target)));
        }

        RateSnapshot snapshot = builder.build();
        log.debug("Parsed snapshot for {}: base={}, rates={}", snapshotDate, baseCurrency, snapshot.getRates().size());
        return snapshot;
    }

    private JsonObject requireObject(JsonObject parent, String field, LocalDate snapshotDate) {
        Object value = parent.getValue(field);
        if (!(value instanceof JsonObject)) {
            throw PipelineException.inputError(
                    "Raw snapshot for " + snapshotDate + " is missing object '" + field + "'");
        }
        return (JsonObject) value;
    }

    private LocalDateTime parseCollectionTimestamp(JsonObject metadata, LocalDate snapshotDate) {
        String value = metadata.getString(COLLECTION_TIMESTAMP);
        if (value == null) {
            throw PipelineException.inputError(
                    "Raw snapshot for " + snapshotDate + " is missing " + COLLECTION_TIMESTAMP);
        }
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw PipelineException.inputError(
                    "Invalid " + COLLECTION_TIMESTAMP + " '" + value + "' in snapshot for " + snapshotDate);
        }
    }

    /**
     * Records are dated by their collection day, so the snapshot key, the stamped collection date
     * and the collection timestamp have to name the same day.
     */
    private void checkCollectionDate(JsonObject metadata, LocalDateTime collectedAt, LocalDate snapshotDate) {
        if (!collectedAt.toLocalDate().equals(snapshotDate)) {
            throw PipelineException.inputError("Snapshot for " + snapshotDate + " was collected at " + collectedAt);
        }
        String stamped = metadata.getString(COLLECTION_DATE);
        if (stamped == null) {
            return;
        }
        try {
            if (!LocalDate.parse(stamped).equals(snapshotDate)) {
                throw PipelineException.inputError(
                        "Snapshot for " + snapshotDate + " is stamped with " + COLLECTION_DATE + " " + stamped);
            }
        } catch (DateTimeParseException e) {
            throw PipelineException.inputError(
                    "Invalid " + COLLECTION_DATE + " '" + stamped + "' in snapshot for " + snapshotDate);
        }
    }

    private LocalDateTime parseLastUpdate(JsonObject apiResponse, LocalDateTime fallback) {
        Object value = apiResponse.getValue(TIME_LAST_UPDATE_UNIX);
        if (!(value instanceof Number)) {
            return fallback;
        }
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(((Number) value).longValue()), ZoneOffset.UTC);
    }

    private Double toRate(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                log.debug("Non-numeric rate value '{}'", value);
            }
        }
        return null;
    }
}
