package com.fxpipeline.application.port.in;

/**
 * Stages of the pipeline, in execution order.
 */
public enum PipelineStage {
    INGEST("ingest"),
    VALIDATE("validate"),
    AGGREGATE("aggregate"),
    ALL("all");

    private final String value;

    PipelineStage(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PipelineStage fromValue(String value) {
        for (PipelineStage stage : values()) {
            if (stage.value.equalsIgnoreCase(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + value);
    }

    public static boolean isValid(String value) {
        for (PipelineStage stage : values()) {
            if (stage.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
