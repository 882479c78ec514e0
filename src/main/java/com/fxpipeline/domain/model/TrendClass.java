package com.fxpipeline.domain.model;

/**
 * Direction of the latest day-over-day change, in percent.
 */
public enum TrendClass {
    STRONG_UP("StrongUp"),
    UP("Up"),
    STABLE("Stable"),
    DOWN("Down"),
    STRONG_DOWN("StrongDown");

    private static final double STRONG_THRESHOLD = 2.0;
    private static final double STABLE_THRESHOLD = 0.5;

    private final String value;

    TrendClass(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TrendClass classify(double dailyChangePct) {
        if (dailyChangePct > STRONG_THRESHOLD) {
            return STRONG_UP;
        }
        if (dailyChangePct > STABLE_THRESHOLD) {
            return UP;
        }
        if (dailyChangePct >= -STABLE_THRESHOLD) {
            return STABLE;
        }
        if (dailyChangePct >= -STRONG_THRESHOLD) {
            return DOWN;
        }
        return STRONG_DOWN;
    }

    public static TrendClass fromValue(String value) {
        for (TrendClass trendClass : values()) {
            if (trendClass.value.equalsIgnoreCase(value)) {
                return trendClass;
            }
        }
        throw new IllegalArgumentException("Unknown trend class: " + value);
    }
}
