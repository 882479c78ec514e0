package com.fxpipeline.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fxpipeline.application.port.in.ProcessingReport;
import com.fxpipeline.application.service.PipelineRunner;

import java.util.List;

/**
 * Response of a pipeline run over HTTP.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineRunResponse(
        String status,
        String stage,
        List<ProcessingReport> reports,
        String message
) {
    public static PipelineRunResponse of(String stage, List<ProcessingReport> reports) {
        String status = PipelineRunner.allSucceeded(reports) ? ProcessingReport.SUCCESS : ProcessingReport.ERROR;
        return new PipelineRunResponse(status, stage, reports, null);
    }

    public static PipelineRunResponse error(String message) {
        return new PipelineRunResponse(ProcessingReport.ERROR, null, null, message);
    }
}
