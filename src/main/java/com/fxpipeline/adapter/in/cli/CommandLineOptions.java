package com.fxpipeline.adapter.in.cli;

import com.fxpipeline.application.port.in.AggregationStageUseCase;
import com.fxpipeline.application.port.in.PipelineStage;
import com.fxpipeline.domain.error.PipelineException;
import com.fxpipeline.domain.rule.CurrencyCodeRule;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Parsed command line. Absent currency and window fall back to configuration.
 */
public record CommandLineOptions(
        PipelineStage stage,
        LocalDate targetDate,
        String baseCurrency,
        Integer windowDays,
        Path configFile,
        boolean serve
) {
    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: fx-rate-pipeline [options]",
            "  --stage ingest|validate|aggregate|all   stage to run (default: all)",
            "  --date YYYY-MM-DD                       target date (default: today)",
            "  --currency XXX                          base currency (default: from configuration)",
            "  --window-days N                         aggregation window in days",
            "  --config PATH                           configuration file (default: classpath application.yml)",
            "  --serve                                 start the HTTP API instead of running once",
            "  --help                                  print this message");

    /**
     * @throws PipelineException with category INPUT_ERROR on unknown or malformed arguments
     */
    public static CommandLineOptions parse(String[] args, LocalDate today) {
        PipelineStage stage = PipelineStage.ALL;
        LocalDate targetDate = today;
        String baseCurrency = null;
        Integer windowDays = null;
        Path configFile = null;
        boolean serve = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--stage":
                    String stageValue = valueOf(args, ++i, arg);
                    if (!PipelineStage.isValid(stageValue)) {
                        throw PipelineException.inputError("Unknown stage: " + stageValue);
                    }
                    stage = PipelineStage.fromValue(stageValue);
                    break;
                case "--date":
                    targetDate = parseDate(valueOf(args, ++i, arg));
                    break;
                case "--currency":
                    baseCurrency = valueOf(args, ++i, arg);
                    if (!CurrencyCodeRule.isWellFormed(baseCurrency)) {
                        throw PipelineException.inputError("Currency must be a 3-letter code: " + baseCurrency);
                    }
                    baseCurrency = CurrencyCodeRule.normalize(baseCurrency);
                    break;
                case "--window-days":
                    windowDays = parseWindow(valueOf(args, ++i, arg));
                    break;
                case "--config":
                    configFile = Path.of(valueOf(args, ++i, arg));
                    break;
                case "--serve":
                    serve = true;
                    break;
                default:
                    throw PipelineException.inputError("Unknown argument: " + arg);
            }
        }
        return new CommandLineOptions(stage, targetDate, baseCurrency, windowDays, configFile, serve);
    }

    public static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw PipelineException.inputError("Missing value for " + option);
        }
        return args[index];
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw PipelineException.inputError("Invalid date (expected YYYY-MM-DD): " + value);
        }
    }

    private static int parseWindow(String value) {
        try {
            int days = Integer.parseInt(value);
            if (!AggregationStageUseCase.isValidWindow(days)) {
                throw PipelineException.inputError(
                        "Window must be between 1 and " + AggregationStageUseCase.MAX_WINDOW_DAYS + " days: " + value);
            }
            return days;
        } catch (NumberFormatException e) {
            throw PipelineException.inputError("Window must be a whole number of days: " + value);
        }
    }
}
