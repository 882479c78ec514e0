package com.fxpipeline.domain.rule;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Sanity bounds for an exchange rate.
 */
public final class RateRangeRule {

    public static final double MAX_RATE = 1_000_000.0;
    public static final int RATE_SCALE = 8;

    private RateRangeRule() {
    }

    /**
     * Finite, not above {@link #MAX_RATE}, and still positive once rounded to {@link #RATE_SCALE} decimals.
     */
    public static boolean isValid(Double rate) {
        if (rate == null || rate.isNaN() || rate.isInfinite()) {
            return false;
        }
        return rate > 0 && rate <= MAX_RATE && round(rate) > 0;
    }

    /**
     * Out of range regardless of finiteness; used when re-checking an already loaded batch.
     */
    public static boolean isOutOfRange(double rate) {
        return rate <= 0 || rate > MAX_RATE;
    }

    public static double round(double rate) {
        return BigDecimal.valueOf(rate).setScale(RATE_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
