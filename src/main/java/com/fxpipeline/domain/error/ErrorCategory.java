package com.fxpipeline.domain.error;

/**
 * Categories of run-level failures.
 */
public enum ErrorCategory {
    INPUT_ERROR(true),
    SNAPSHOT_NOT_FOUND(true),
    EMPTY_BATCH(true),
    NO_DATA_FOR_PERIOD(true),
    UPSTREAM_ERROR(false),
    STORAGE_ERROR(false),
    CONFIGURATION_ERROR(false),
    INTERNAL_ERROR(false);

    private final boolean clientError;

    ErrorCategory(boolean clientError) {
        this.clientError = clientError;
    }

    /**
     * True when the failure is caused by what was asked for rather than by the system itself.
     */
    public boolean isClientError() {
        return clientError;
    }
}
