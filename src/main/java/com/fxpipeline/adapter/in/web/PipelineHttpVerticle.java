package com.fxpipeline.adapter.in.web;

import com.fxpipeline.infrastructure.config.JsonMappers;
import com.fxpipeline.infrastructure.config.PipelineConfig;
import com.fxpipeline.infrastructure.config.PipelineModule;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - exposes pipeline runs and stored overviews.
 * Wires the pipeline from its deployment config unless a module is supplied.
 */
@Slf4j
public class PipelineHttpVerticle extends AbstractVerticle {

    private final Clock clock;
    private PipelineModule module;
    private HttpServer server;

    public PipelineHttpVerticle() {
        this(null, Clock.systemUTC());
    }

    public PipelineHttpVerticle(PipelineModule module, Clock clock) {
        this.module = module;
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");
        JsonMappers.registerWithVertx();

        try {
            if (module == null) {
                module = new PipelineModule(vertx, PipelineConfig.fromJson(config()), clock);
            }
        } catch (Exception e) {
            log.error("Failed to wire pipeline", e);
            startPromise.fail(e);
            return;
        }

        startHttpServer()
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        WebRouter webRouter = new WebRouter(router,
                new PipelineRunHandler(module.getRunner(), module.getConfig(), clock),
                new OverviewQueryHandler(module.getAnalyticsRepository()));
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = module.getConfig().getHttpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(listening -> {
                    server = listening;
                    log.info("HTTP server listening on port {}", listening.actualPort());
                })
                .mapEmpty();
    }

    /**
     * Bound port; differs from the configured one when that is 0.
     */
    public int actualPort() {
        return server != null ? server.actualPort() : -1;
    }
}
