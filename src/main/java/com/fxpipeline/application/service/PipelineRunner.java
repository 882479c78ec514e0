package com.fxpipeline.application.service;

import com.fxpipeline.application.port.in.AggregationStageUseCase;
import com.fxpipeline.application.port.in.PipelineStage;
import com.fxpipeline.application.port.in.ProcessingReport;
import com.fxpipeline.application.port.in.RateIngestionUseCase;
import com.fxpipeline.application.port.in.ValidationStageUseCase;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs one stage, or all of them in order stopping at the first failed report.
 */
@Slf4j
@RequiredArgsConstructor
public class PipelineRunner {

    private final RateIngestionUseCase ingestionUseCase;
    private final ValidationStageUseCase validationUseCase;
    private final AggregationStageUseCase aggregationUseCase;

    public Future<List<ProcessingReport>> run(PipelineStage stage, LocalDate targetDate,
                                              String baseCurrency, int windowDays) {
        log.info("Pipeline run requested: stage={}, date={}, base={}, windowDays={}",
                stage.getValue(), targetDate, baseCurrency, windowDays);

        switch (stage) {
            case INGEST:
                return ingestionUseCase.ingest(targetDate, baseCurrency).map(List::of);
            case VALIDATE:
                return validationUseCase.process(targetDate).map(List::of);
            case AGGREGATE:
                return aggregationUseCase.process(targetDate, windowDays).map(List::of);
            case ALL:
            default:
                return runAll(targetDate, baseCurrency, windowDays);
        }
    }

    private Future<List<ProcessingReport>> runAll(LocalDate targetDate, String baseCurrency, int windowDays) {
        List<ProcessingReport> reports = new ArrayList<>();
        return ingestionUseCase.ingest(targetDate, baseCurrency)
                .compose(report -> continueIf(reports, report, () -> validationUseCase.process(targetDate)))
                .compose(report -> continueIf(reports, report, () -> aggregationUseCase.process(targetDate, windowDays)))
                .map(report -> {
                    if (report != null) {
                        reports.add(report);
                    }
                    log.info("Pipeline run finished: stages={}, success={}",
                            reports.size(), reports.stream().allMatch(ProcessingReport::isSuccess));
                    return List.copyOf(reports);
                });
    }

    private Future<ProcessingReport> continueIf(List<ProcessingReport> reports, ProcessingReport report,
                                                Supplier<Future<ProcessingReport>> next) {
        if (report == null) {
            return Future.succeededFuture();
        }
        reports.add(report);
        if (!report.isSuccess()) {
            log.warn("Stage {} failed, remaining stages skipped", report.stage());
            return Future.succeededFuture();
        }
        return next.get();
    }

    public static boolean allSucceeded(List<ProcessingReport> reports) {
        return !reports.isEmpty() && reports.stream().allMatch(ProcessingReport::isSuccess);
    }
}
