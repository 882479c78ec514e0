package com.fxpipeline.adapter.in.web;

import com.fxpipeline.application.port.out.AnalyticsRepository;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * HTTP handler for stored market overviews
 * Handles GET /api/overview/:date
 */
@Slf4j
@RequiredArgsConstructor
public class OverviewQueryHandler implements Handler<RoutingContext> {

    private final AnalyticsRepository analyticsRepository;

    @Override
    public void handle(RoutingContext context) {
        LocalDate date;
        try {
            date = LocalDate.parse(context.pathParam("date"));
        } catch (DateTimeParseException e) {
            sendError(context, 400, "Invalid date (expected YYYY-MM-DD): " + context.pathParam("date"));
            return;
        }

        analyticsRepository.loadOverview(date)
                .onSuccess(overview -> {
                    if (overview.isEmpty()) {
                        sendError(context, 404, "No market overview for " + date);
                        return;
                    }
                    context.response()
                            .setStatusCode(200)
                            .putHeader("Content-Type", "application/json")
                            .end(overview.get().encode());
                })
                .onFailure(error -> {
                    log.error("Failed to load market overview for {}: {}", date, error.getMessage(), error);
                    sendError(context, 500, error.getMessage());
                });
    }

    private void sendError(RoutingContext context, int statusCode, String message) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("status", "error")
                        .put("message", message)
                        .encode());
    }
}
