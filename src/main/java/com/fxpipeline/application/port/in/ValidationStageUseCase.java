package com.fxpipeline.application.port.in;

import io.vertx.core.Future;

import java.time.LocalDate;

/**
 * Input port: normalize, validate and quality-score one day's snapshot.
 */
public interface ValidationStageUseCase {

    /**
     * Never fails; errors are reported in the returned report.
     */
    Future<ProcessingReport> process(LocalDate targetDate);
}
