package com.fxpipeline.application.port.in;

import io.vertx.core.Future;

import java.time.LocalDate;

/**
 * Input port: aggregate validated data over a trailing window ending at the target date.
 */
public interface AggregationStageUseCase {

    int MAX_WINDOW_DAYS = 365;

    static boolean isValidWindow(int windowDays) {
        return windowDays >= 1 && windowDays <= MAX_WINDOW_DAYS;
    }

    /**
     * Never fails; errors are reported in the returned report.
     * @param windowDays number of days to include, the target date being the last one;
     *                   between 1 and {@link #MAX_WINDOW_DAYS}
     */
    Future<ProcessingReport> process(LocalDate targetDate, int windowDays);
}
