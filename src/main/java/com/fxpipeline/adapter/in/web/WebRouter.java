package com.fxpipeline.adapter.in.web;

import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for pipeline endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final PipelineRunHandler pipelineRunHandler;
    private final OverviewQueryHandler overviewQueryHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options("/api/pipeline/:stage").handler(ctx -> ctx.response().setStatusCode(204).end());

        router.post("/api/pipeline/:stage")
                .handler(BodyHandler.create())
                .handler(pipelineRunHandler);

        router.get("/api/overview/:date")
                .handler(overviewQueryHandler);

        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"fx-rate-pipeline\"}"));

        router.get("/")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"name\":\"FX Rate Pipeline\",\"version\":\"1.0.0\"}"));
    }
}
