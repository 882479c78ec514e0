package com.fxpipeline;

import com.fxpipeline.adapter.in.cli.CommandLineOptions;
import com.fxpipeline.adapter.in.web.PipelineHttpVerticle;
import com.fxpipeline.application.port.in.ProcessingReport;
import com.fxpipeline.application.service.PipelineRunner;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.infrastructure.config.ConfigLoader;
import com.fxpipeline.infrastructure.config.JsonMappers;
import com.fxpipeline.infrastructure.config.PipelineConfig;
import com.fxpipeline.infrastructure.config.PipelineModule;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Main application entry point
 * Runs pipeline stages once from the command line, or serves the HTTP API with --serve.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        if (CommandLineOptions.isHelpRequested(args)) {
            System.out.println(CommandLineOptions.USAGE);
            return;
        }

        Clock clock = Clock.systemUTC();
        CommandLineOptions options;
        JsonObject rawConfig;
        PipelineConfig config;
        try {
            options = CommandLineOptions.parse(args, LocalDate.now(clock));
            rawConfig = new ConfigLoader().load(options.configFile());
            config = PipelineConfig.fromJson(rawConfig);
        } catch (PipelineException e) {
            log.error("{}: {}", e.getCategory(), e.getMessage());
            System.err.println(CommandLineOptions.USAGE);
            System.exit(EXIT_FAILURE);
            return;
        }

        Vertx vertx = Vertx.vertx(new VertxOptions().setWorkerPoolSize(4).setEventLoopPoolSize(2));
        JsonMappers.registerWithVertx();

        if (options.serve()) {
            serve(vertx, rawConfig, clock);
        } else {
            int exitCode = runOnce(vertx, config, options, clock);
            vertx.close();
            System.exit(exitCode);
        }
    }

    private static void serve(Vertx vertx, JsonObject rawConfig, Clock clock) {
        log.info("Starting FX Rate Pipeline API...");
        vertx.deployVerticle(new PipelineHttpVerticle(null, clock), new DeploymentOptions()
                        .setConfig(rawConfig)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down FX Rate Pipeline API...");
                        vertx.close();
                    }));

                    log.info("FX Rate Pipeline API is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                    System.exit(EXIT_FAILURE);
                });
    }

    static int runOnce(Vertx vertx, PipelineConfig config, CommandLineOptions options, Clock clock) {
        PipelineModule module = new PipelineModule(vertx, config, clock);
        String baseCurrency = options.baseCurrency() != null ? options.baseCurrency() : config.getBaseCurrency();
        int windowDays = options.windowDays() != null ? options.windowDays() : config.getWindowDays();

        try {
            List<ProcessingReport> reports = module.getRunner()
                    .run(options.stage(), options.targetDate(), baseCurrency, windowDays)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .join();
            System.out.println(JsonMappers.pretty().writeValueAsString(reports));
            boolean success = PipelineRunner.allSucceeded(reports);
            log.info("Pipeline {} for {}: {}", options.stage().getValue(), options.targetDate(),
                    success ? "SUCCESS" : "FAILED");
            return success ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Pipeline run failed unexpectedly", e);
            return EXIT_FAILURE;
        }
    }
}
