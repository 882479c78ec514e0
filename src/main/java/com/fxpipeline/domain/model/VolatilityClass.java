package com.fxpipeline.domain.model;

/**
 * Volatility buckets over the average 7-day volatility, ordered by exclusive upper bound.
 */
public enum VolatilityClass {
    LOW("Low", 1.0),
    MODERATE("Moderate", 2.0),
    HIGH("High", 5.0),
    VERY_HIGH("VeryHigh", Double.POSITIVE_INFINITY);

    private final String value;
    private final double upperBound;

    VolatilityClass(String value, double upperBound) {
        this.value = value;
        this.upperBound = upperBound;
    }

    public String getValue() {
        return value;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public static VolatilityClass classify(double avgVolatility) {
        for (VolatilityClass volatilityClass : values()) {
            if (avgVolatility < volatilityClass.upperBound) {
                return volatilityClass;
            }
        }
        return VERY_HIGH;
    }

    public static VolatilityClass fromValue(String value) {
        for (VolatilityClass volatilityClass : values()) {
            if (volatilityClass.value.equalsIgnoreCase(value)) {
                return volatilityClass;
            }
        }
        throw new IllegalArgumentException("Unknown volatility class: " + value);
    }
}
