package com.fxpipeline.application.port.in;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fxpipeline.domain.error.ErrorCategory;
import com.fxpipeline.domain.error.PipelineException;

import java.time.LocalDate;
import java.util.Map;

/**
 * Outcome of one stage run: counters and outputs on success, category and message on error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingReport(
        @JsonProperty("status") String status,
        @JsonProperty("stage") String stage,
        @JsonProperty("target_date") LocalDate targetDate,
        @JsonProperty("execution_time_seconds") double executionTimeSeconds,
        @JsonProperty("counters") Map<String, Object> counters,
        @JsonProperty("output_files") Map<String, String> outputFiles,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("error_category") ErrorCategory errorCategory,
        @JsonProperty("error_message") String errorMessage
) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static ProcessingReport success(PipelineStage stage, LocalDate targetDate, double executionTimeSeconds,
                                           Map<String, Object> counters, Map<String, String> outputFiles,
                                           Map<String, Object> details) {
        return new ProcessingReport(SUCCESS, stage.getValue(), targetDate, executionTimeSeconds,
                counters, outputFiles, details, null, null);
    }

    public static ProcessingReport error(PipelineStage stage, LocalDate targetDate, double executionTimeSeconds,
                                         Throwable error) {
        return new ProcessingReport(ERROR, stage.getValue(), targetDate, executionTimeSeconds,
                null, null, null, PipelineException.categoryOf(error), error.getMessage());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
