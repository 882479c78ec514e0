package com.fxpipeline.domain.error;

import lombok.Getter;

/**
 * Fatal failure of a pipeline run.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final ErrorCategory category;

    public PipelineException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public PipelineException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public static PipelineException inputError(String message) {
        return new PipelineException(ErrorCategory.INPUT_ERROR, message);
    }

    public static PipelineException snapshotNotFound(String message) {
        return new PipelineException(ErrorCategory.SNAPSHOT_NOT_FOUND, message);
    }

    public static PipelineException storageError(String message, Throwable cause) {
        return new PipelineException(ErrorCategory.STORAGE_ERROR, message, cause);
    }

    public static PipelineException upstreamError(String message) {
        return new PipelineException(ErrorCategory.UPSTREAM_ERROR, message);
    }

    /**
     * Category of any throwable; failures that did not come from the pipeline are internal.
     */
    public static ErrorCategory categoryOf(Throwable error) {
        if (error instanceof PipelineException pipelineException) {
            return pipelineException.getCategory();
        }
        return ErrorCategory.INTERNAL_ERROR;
    }
}
