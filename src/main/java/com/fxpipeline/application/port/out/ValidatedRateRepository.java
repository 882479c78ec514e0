package com.fxpipeline.application.port.out;

import com.fxpipeline.domain.model.RateObservation;
import io.vertx.core.Future;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Output port for the validated layer: accepted observations keyed by date.
 */
public interface ValidatedRateRepository {

    /**
     * @return location of the stored table
     */
    Future<String> save(LocalDate date, List<RateObservation> observations);

    /**
     * @return the stored observations, or empty when the date has no table
     */
    Future<Optional<List<RateObservation>>> load(LocalDate date);
}
