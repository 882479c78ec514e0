package com.fxpipeline.application.service;

import com.fxpipeline.application.port.in.PipelineStage;
import com.fxpipeline.application.port.in.ProcessingReport;
import com.fxpipeline.application.port.in.ValidationStageUseCase;
import com.fxpipeline.application.port.out.RawSnapshotRepository;
import com.fxpipeline.application.port.out.ValidatedRateRepository;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.model.QualityReport;
import com.fxpipeline.domain.model.RateObservation;
import com.fxpipeline.domain.model.RateSnapshot;
import com.fxpipeline.domain.model.RejectedRecord;
import com.fxpipeline.domain.model.ValidationOutcome;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation run for one date: raw snapshot in, validated table and quality report out.
 *
 * <p>The quality score covers the normalized input batch, so rejected records lower it.
 * The score of the accepted batch alone is reported next to it.
 */
@Slf4j
@RequiredArgsConstructor
public class ValidationStageService implements ValidationStageUseCase {

    static final int REJECTION_SAMPLES = 3;

    private final RawSnapshotRepository rawRepository;
    private final ValidatedRateRepository validatedRepository;
    private final SnapshotParser parser;
    private final RecordNormalizer normalizer;
    private final RecordValidator validator;
    private final QualityScorer qualityScorer;

    @Override
    public Future<ProcessingReport> process(LocalDate targetDate) {
        StageTimer timer = StageTimer.start();
        log.info("=== Starting validation stage: date={} ===", targetDate);

        return rawRepository.load(targetDate)
                .map(document -> validate(document, targetDate))
                .compose(result -> validatedRepository.save(targetDate, result.outcome().accepted())
                        .map(location -> succeeded(targetDate, timer, result, location)))
                .otherwise(error -> failed(targetDate, timer, error));
    }

    private StageResult validate(JsonObject document, LocalDate targetDate) {
        RateSnapshot snapshot = parser.parse(document, targetDate);
        List<RateObservation> records = normalizer.normalize(snapshot);
        ValidationOutcome outcome = validator.validate(records);

        if (!outcome.hasAccepted()) {
            throw new PipelineException(ErrorCategory.EMPTY_BATCH,
                    "No valid records after validation (" + outcome.totalRecords() + " rejected)");
        }

        QualityReport inputQuality = qualityScorer.assess(records);
        QualityReport acceptedQuality = qualityScorer.assess(outcome.accepted());
        return new StageResult(outcome, inputQuality, acceptedQuality);
    }

    private ProcessingReport succeeded(LocalDate targetDate, StageTimer timer, StageResult result, String location) {
        ValidationOutcome outcome = result.outcome();

        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("total_raw_records", outcome.totalRecords());
        counters.put("validated_records", outcome.accepted().size());
        counters.put("invalid_records", outcome.rejected().size());
        counters.put("validation_success_rate", outcome.successRate());
        counters.put("quality_score", result.inputQuality().overallScore());
        counters.put("accepted_quality_score", result.acceptedQuality().overallScore());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("quality", result.inputQuality());
        details.put("rejection_samples", outcome.rejectionSamples(REJECTION_SAMPLES).stream()
                .map(this::describe)
                .toList());

        double elapsed = timer.elapsedSeconds();
        log.info("=== Validation stage finished: date={}, records={}, quality={}, seconds={} ===",
                targetDate, outcome.accepted().size(), result.inputQuality().overallScore(), elapsed);
        return ProcessingReport.success(PipelineStage.VALIDATE, targetDate, elapsed,
                counters, Map.of("validated_file", location), details);
    }

    private Map<String, Object> describe(RejectedRecord rejected) {
        Map<String, Object> sample = new LinkedHashMap<>();
        sample.put("record_index", rejected.recordIndex());
        sample.put("pair", rejected.record().getPairKey());
        sample.put("rate", rejected.record().getRate());
        sample.put("violations", rejected.violations());
        return sample;
    }

    private ProcessingReport failed(LocalDate targetDate, StageTimer timer, Throwable error) {
        log.error("=== Validation stage failed: date={}, category={}, error={} ===",
                targetDate, PipelineException.categoryOf(error), error.getMessage());
        return ProcessingReport.error(PipelineStage.VALIDATE, targetDate, timer.elapsedSeconds(), error);
    }

    private record StageResult(ValidationOutcome outcome, QualityReport inputQuality, QualityReport acceptedQuality) {}
}
