package com.fxpipeline.domain.model;

import java.util.List;

/**
 * Result of validating one batch.
 * Every input index lands in exactly one of accepted or rejected.
 */
public record ValidationOutcome(List<RateObservation> accepted, List<RejectedRecord> rejected) {

    public ValidationOutcome {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }

    public int totalRecords() {
        return accepted.size() + rejected.size();
    }

    public boolean hasAccepted() {
        return !accepted.isEmpty();
    }

    public double successRate() {
        int total = totalRecords();
        return total == 0 ? 0.0 : (double) accepted.size() / total;
    }

    public List<RejectedRecord> rejectionSamples(int limit) {
        return rejected.subList(0, Math.min(limit, rejected.size()));
    }
}
