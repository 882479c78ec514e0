package com.fxpipeline.application.service;

import com.fxpipeline.domain.model.DailyMetric;
import com.fxpipeline.domain.model.RateObservation;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups accepted observations by (collection date, target currency).
 * Standard deviation uses the sample convention (n - 1) and is 0 for a single observation.
 */
@Slf4j
public class DailyAggregator {

    private static final Comparator<GroupKey> KEY_ORDER = Comparator
            .comparing(GroupKey::date)
            .thenComparing(GroupKey::currency);

    public List<DailyMetric> aggregate(List<RateObservation> observations) {
        Map<GroupKey, Group> groups = new TreeMap<>(KEY_ORDER);
        for (RateObservation observation : observations) {
            GroupKey key = new GroupKey(observation.getCollectionDate(), observation.getTargetCurrency());
            groups.computeIfAbsent(key, k -> new Group()).add(observation);
        }

        List<DailyMetric> metrics = new ArrayList<>(groups.size());
        groups.forEach((key, group) -> metrics.add(group.toMetric(key)));

        if (!metrics.isEmpty()) {
            log.info("Daily metrics calculated: rows={}, dates {} to {}",
                    metrics.size(), metrics.get(0).getDate(), metrics.get(metrics.size() - 1).getDate());
        }
        return metrics;
    }

    private record GroupKey(LocalDate date, String currency) {}

    private static final class Group {
        private final DescriptiveStatistics rates = new DescriptiveStatistics();
        private LocalDateTime lastUpdate;

        void add(RateObservation observation) {
            rates.addValue(observation.getRate());
            LocalDateTime collectedAt = observation.getCollectedAt();
            if (collectedAt != null && (lastUpdate == null || collectedAt.isAfter(lastUpdate))) {
                lastUpdate = collectedAt;
            }
        }

        DailyMetric toMetric(GroupKey key) {
            double mean = rates.getMean();
            double std = rates.getN() > 1 ? rates.getStandardDeviation() : 0.0;
            double min = rates.getMin();
            double max = rates.getMax();
            double cv = mean == 0.0 || Double.isNaN(std) ? 0.0 : std / mean;

            return DailyMetric.builder()
                    .date(key.date())
                    .currency(key.currency())
                    .rateMean(mean)
                    .rateStd(std)
                    .rateMin(min)
                    .rateMax(max)
                    .observationCount((int) rates.getN())
                    .rateRange(max - min)
                    .coefficientOfVariation(cv)
                    .lastUpdate(lastUpdate)
                    .build();
        }
    }
}
