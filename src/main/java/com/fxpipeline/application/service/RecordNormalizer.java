package com.fxpipeline.application.service;

import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.model.RateSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Expands a snapshot into one observation per target currency. Performs no validation.
 */
@Slf4j
public class RecordNormalizer {

    public List<RateObservation> normalize(RateSnapshot snapshot) {
        LocalDate collectionDate = snapshot.getCollectedAt() != null
                ? snapshot.getCollectedAt().toLocalDate()
                : snapshot.getSnapshotDate();

        List<RateObservation> observations = new ArrayList<>(snapshot.getRates().size());
        for (Map.Entry<String, Double> entry : snapshot.getRates().entrySet()) {
            observations.add(RateObservation.builder()
                    .baseCurrency(snapshot.getBaseCurrency())
                    .targetCurrency(entry.getKey())
                    .rate(entry.getValue())
                    .observedAt(snapshot.getObservedAt())
                    .collectedAt(snapshot.getCollectedAt())
                    .collectionDate(collectionDate)
                    .pipelineVersion(snapshot.getPipelineVersion())
                    .build());
        }

        log.info("Normalized snapshot: base={}, records={}", snapshot.getBaseCurrency(), observations.size());
        return observations;
    }
}
