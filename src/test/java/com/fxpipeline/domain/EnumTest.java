package com.fxpipeline.domain;

import com.fxpipeline.application.port.in.PipelineStage;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.model.TrendClass;
import com.fxpipeline.domain.model.ValidationRule;
import com.fxpipeline.domain.model.VolatilityClass;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for enums
 */
class EnumTest {

    @Test
    void testVolatilityClassBoundaries() {
        assertEquals(VolatilityClass.LOW, VolatilityClass.classify(0.0));
        assertEquals(VolatilityClass.LOW, VolatilityClass.classify(0.999));
        assertEquals(VolatilityClass.MODERATE, VolatilityClass.classify(1.0));
        assertEquals(VolatilityClass.MODERATE, VolatilityClass.classify(1.999));
        assertEquals(VolatilityClass.HIGH, VolatilityClass.classify(2.0));
        assertEquals(VolatilityClass.HIGH, VolatilityClass.classify(4.99));
        assertEquals(VolatilityClass.VERY_HIGH, VolatilityClass.classify(5.0));
        assertEquals(VolatilityClass.VERY_HIGH, VolatilityClass.classify(250.0));

        assertEquals("VeryHigh", VolatilityClass.VERY_HIGH.getValue());
        assertEquals(VolatilityClass.MODERATE, VolatilityClass.fromValue("moderate"));
        assertThrows(IllegalArgumentException.class, () -> VolatilityClass.fromValue("Extreme"));
    }

    @Test
    void testTrendClassBoundaries() {
        assertEquals(TrendClass.STRONG_UP, TrendClass.classify(2.01));
        assertEquals(TrendClass.UP, TrendClass.classify(2.0));
        assertEquals(TrendClass.UP, TrendClass.classify(0.51));
        assertEquals(TrendClass.STABLE, TrendClass.classify(0.5));
        assertEquals(TrendClass.STABLE, TrendClass.classify(0.0));
        assertEquals(TrendClass.STABLE, TrendClass.classify(-0.5));
        assertEquals(TrendClass.DOWN, TrendClass.classify(-0.51));
        assertEquals(TrendClass.DOWN, TrendClass.classify(-2.0), "-2 itself is Down, not StrongDown");
        assertEquals(TrendClass.STRONG_DOWN, TrendClass.classify(-2.01));

        assertEquals("StrongUp", TrendClass.STRONG_UP.getValue());
        assertEquals(TrendClass.STRONG_DOWN, TrendClass.fromValue("strongdown"));
        assertThrows(IllegalArgumentException.class, () -> TrendClass.fromValue("Sideways"));
    }

    @Test
    void testPipelineStage() {
        assertEquals(PipelineStage.INGEST, PipelineStage.fromValue("ingest"));
        assertEquals(PipelineStage.AGGREGATE, PipelineStage.fromValue("AGGREGATE"));
        assertTrue(PipelineStage.isValid("all"));
        assertFalse(PipelineStage.isValid("publish"));
        assertThrows(IllegalArgumentException.class, () -> PipelineStage.fromValue("publish"));
    }

    @Test
    void testValidationRule() {
        for (ValidationRule rule : ValidationRule.values()) {
            assertEquals(rule, ValidationRule.fromValue(rule.getValue()));
        }
        assertThrows(IllegalArgumentException.class, () -> ValidationRule.fromValue("no_such_rule"));
    }

    @Test
    void testErrorCategoryClientErrors() {
        assertTrue(ErrorCategory.INPUT_ERROR.isClientError());
        assertTrue(ErrorCategory.SNAPSHOT_NOT_FOUND.isClientError());
        assertTrue(ErrorCategory.EMPTY_BATCH.isClientError());
        assertTrue(ErrorCategory.NO_DATA_FOR_PERIOD.isClientError());
        assertFalse(ErrorCategory.UPSTREAM_ERROR.isClientError());
        assertFalse(ErrorCategory.STORAGE_ERROR.isClientError());
        assertFalse(ErrorCategory.INTERNAL_ERROR.isClientError());
    }
}
