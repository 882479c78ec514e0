package com.fxpipeline.adapter.in.web;

import com.fxpipeline.application.port.in.AggregationStageUseCase;
import com.fxpipeline.application.port.in.PipelineStage;
import com.fxpipeline.application.port.in.ProcessingReport;
import com.fxpipeline.application.service.PipelineRunner;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.infrastructure.config.PipelineConfig;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RequestBody;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * HTTP handler for pipeline runs
 * Handles POST /api/pipeline/:stage
 */
@Slf4j
@RequiredArgsConstructor
public class PipelineRunHandler implements Handler<RoutingContext> {

    private final PipelineRunner runner;
    private final PipelineConfig config;
    private final Clock clock;

    @Override
    public void handle(RoutingContext context) {
        String stageParam = context.pathParam("stage");
        if (!PipelineStage.isValid(stageParam)) {
            sendError(context, 400, "Unknown stage: " + stageParam);
            return;
        }
        PipelineStage stage = PipelineStage.fromValue(stageParam);

        PipelineRunRequest request;
        LocalDate targetDate;
        try {
            request = readRequest(context.body());
            targetDate = request.date() != null ? LocalDate.parse(request.date()) : LocalDate.now(clock);
        } catch (DateTimeParseException e) {
            sendError(context, 400, "Invalid date (expected YYYY-MM-DD): " + e.getParsedString());
            return;
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        String baseCurrency = request.baseCurrency() != null ? request.baseCurrency() : config.getBaseCurrency();
        int windowDays = request.windowDays() != null ? request.windowDays() : config.getWindowDays();
        if (!AggregationStageUseCase.isValidWindow(windowDays)) {
            sendError(context, 400, "windowDays must be between 1 and " + AggregationStageUseCase.MAX_WINDOW_DAYS);
            return;
        }
        log.info("Received pipeline request: stage={}, date={}", stage.getValue(), targetDate);

        runner.run(stage, targetDate, baseCurrency, windowDays)
                .onSuccess(reports -> {
                    PipelineRunResponse response = PipelineRunResponse.of(stage.getValue(), reports);
                    context.response()
                            .setStatusCode(statusCode(reports))
                            .putHeader("Content-Type", "application/json")
                            .end(JsonObject.mapFrom(response).encode());
                })
                .onFailure(error -> {
                    log.error("Pipeline request failed: {}", error.getMessage(), error);
                    sendError(context, 500, error.getMessage());
                });
    }

    private static PipelineRunRequest readRequest(RequestBody body) {
        if (body == null || body.isEmpty()) {
            return new PipelineRunRequest(null, null, null);
        }
        JsonObject json = body.asJsonObject();
        return json == null ? new PipelineRunRequest(null, null, null) : json.mapTo(PipelineRunRequest.class);
    }

    static int statusCode(List<ProcessingReport> reports) {
        for (ProcessingReport report : reports) {
            if (!report.isSuccess()) {
                ErrorCategory category = report.errorCategory();
                return category != null && category.isClientError() ? 400 : 500;
            }
        }
        return 200;
    }

    private void sendError(RoutingContext context, int statusCode, String message) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(PipelineRunResponse.error(message)).encode());
    }
}
