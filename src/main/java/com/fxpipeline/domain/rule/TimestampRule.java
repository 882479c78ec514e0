package com.fxpipeline.domain.rule;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Plausibility checks for provider and collection timestamps.
 */
public final class TimestampRule {

    public static final int MIN_YEAR = 2000;
    public static final int MAX_YEAR = 2030;

    // Collection may precede the provider update by up to a week and trail it by up to a day
    private static final Duration MAX_COLLECTION_LEAD = Duration.ofDays(7);
    private static final Duration MAX_COLLECTION_LAG = Duration.ofDays(1);

    private TimestampRule() {
    }

    public static boolean isWithinYearRange(LocalDateTime timestamp) {
        if (timestamp == null) {
            return false;
        }
        int year = timestamp.getYear();
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    public static boolean isReasonableCollectionTime(LocalDateTime collectedAt, LocalDateTime observedAt) {
        if (collectedAt == null || observedAt == null) {
            return false;
        }
        return !collectedAt.isBefore(observedAt.minus(MAX_COLLECTION_LEAD))
                && !collectedAt.isAfter(observedAt.plus(MAX_COLLECTION_LAG));
    }
}
