package com.fxpipeline.application.port.in;

import io.vertx.core.Future;

import java.time.LocalDate;

/**
 * Input port: fetch one snapshot from the provider and store it in the raw layer.
 */
public interface RateIngestionUseCase {

    /**
     * Never fails; errors are reported in the returned report.
     */
    Future<ProcessingReport> ingest(LocalDate targetDate, String baseCurrency);
}
