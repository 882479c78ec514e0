package com.fxpipeline.application.service;

import com.fxpipeline.TestData;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.model.RateSnapshot;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SnapshotParser and RecordNormalizer
 */
class SnapshotParserTest {

    private SnapshotParser parser;
    private RecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        parser = new SnapshotParser();
        normalizer = new RecordNormalizer();
    }

    @Test
    void testParseRawDocument() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("BRL", 5.50).put("EUR", 0.90));

        RateSnapshot snapshot = parser.parse(document, TestData.DATE);

        assertEquals("USD", snapshot.getBaseCurrency());
        assertEquals(TestData.COLLECTED_AT, snapshot.getCollectedAt());
        assertEquals(TestData.OBSERVED_AT, snapshot.getObservedAt());
        assertEquals("1.0.0", snapshot.getPipelineVersion());
        assertEquals(List.of("BRL", "EUR"), List.copyOf(snapshot.getRates().keySet()));
        assertEquals(5.50, snapshot.getRates().get("BRL"));
    }

    @Test
    void testNormalizeYieldsOneObservationPerRate() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("BRL", 5.50).put("EUR", 0.90));

        List<RateObservation> observations = normalizer.normalize(parser.parse(document, TestData.DATE));

        assertEquals(2, observations.size());
        RateObservation brl = observations.get(0);
        assertEquals("USD", brl.getBaseCurrency());
        assertEquals("BRL", brl.getTargetCurrency());
        assertEquals(5.50, brl.getRate());
        assertEquals(TestData.OBSERVED_AT, brl.getObservedAt());
        assertEquals(TestData.COLLECTED_AT, brl.getCollectedAt());
        assertEquals(TestData.COLLECTED_AT.toLocalDate(), brl.getCollectionDate());
        assertEquals(0, brl.missingFieldCount());
    }

    @Test
    void testNonNumericRateBecomesNull() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("EUR", "n/a").put("GBP", "0.79"));

        RateSnapshot snapshot = parser.parse(document, TestData.DATE);

        assertNull(snapshot.getRates().get("EUR"));
        assertEquals(0.79, snapshot.getRates().get("GBP"));
    }

    @Test
    void testMissingProviderTimestampFallsBackToCollectionTime() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("EUR", 0.9));
        document.getJsonObject("api_response").remove("time_last_update_unix");

        RateSnapshot snapshot = parser.parse(document, TestData.DATE);

        assertEquals(TestData.COLLECTED_AT, snapshot.getObservedAt());
    }

    @Test
    void testMissingApiResponseIsInputError() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("EUR", 0.9));
        document.remove("api_response");

        PipelineException error = assertThrows(PipelineException.class, () -> parser.parse(document, TestData.DATE));
        assertEquals(ErrorCategory.INPUT_ERROR, error.getCategory());
    }

    @Test
    void testEmptyRatesIsInputError() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject());

        PipelineException error = assertThrows(PipelineException.class, () -> parser.parse(document, TestData.DATE));
        assertEquals(ErrorCategory.INPUT_ERROR, error.getCategory());
        assertTrue(error.getMessage().contains("no rates"));
    }

    @Test
    void testMalformedCollectionTimestampIsInputError() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("EUR", 0.9));
        document.getJsonObject("pipeline_metadata").put("collection_timestamp", "yesterday");

        PipelineException error = assertThrows(PipelineException.class, () -> parser.parse(document, TestData.DATE));
        assertEquals(ErrorCategory.INPUT_ERROR, error.getCategory());
    }

    @Test
    void testCollectionAfterMidnightIsInputError() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("EUR", 0.9));
        document.getJsonObject("pipeline_metadata").put("collection_timestamp", "2024-03-16T00:30:00");

        PipelineException error = assertThrows(PipelineException.class, () -> parser.parse(document, TestData.DATE));
        assertEquals(ErrorCategory.INPUT_ERROR, error.getCategory());
        assertTrue(error.getMessage().contains("2024-03-16T00:30"));
    }

    @Test
    void testSnapshotStoredUnderAnotherDayIsInputError() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("EUR", 0.9));

        PipelineException error = assertThrows(PipelineException.class,
                () -> parser.parse(document, TestData.DATE.minusDays(1)));
        assertEquals(ErrorCategory.INPUT_ERROR, error.getCategory());
    }

    @Test
    void testMismatchedCollectionDateIsInputError() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("EUR", 0.9));
        document.getJsonObject("pipeline_metadata").put("collection_date", "2024-03-14");

        PipelineException error = assertThrows(PipelineException.class, () -> parser.parse(document, TestData.DATE));
        assertEquals(ErrorCategory.INPUT_ERROR, error.getCategory());
        assertTrue(error.getMessage().contains("collection_date"));
    }

    @Test
    void testMissingCollectionDateFallsBackToTimestamp() {
        JsonObject document = TestData.rawDocument("USD", new JsonObject().put("EUR", 0.9));
        document.getJsonObject("pipeline_metadata").remove("collection_date");

        List<RateObservation> observations = normalizer.normalize(parser.parse(document, TestData.DATE));

        assertEquals(TestData.DATE, observations.get(0).getCollectionDate());
    }
}
