package com.ledgerlens.backend.exceptions;

/**
 * Base type for every failure raised while turning a raw statement into stored rows.
 * The message always starts with the stage that failed.
 */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, String message) {
        this(stage, message, null);
    }

    public PipelineException(PipelineStage stage, String message, Throwable cause) {
        super(stage.label() + " failed: " + message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }

    /** Whether re-running the same call may succeed without changing the input. */
    public boolean isRetryable() {
        return false;
    }
}
