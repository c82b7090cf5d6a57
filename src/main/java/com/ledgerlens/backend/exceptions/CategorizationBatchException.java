package com.ledgerlens.backend.exceptions;

public class CategorizationBatchException extends PipelineException {

    private final int batchIndex;

    public CategorizationBatchException(int batchIndex, String message) {
        this(batchIndex, message, null);
    }

    public CategorizationBatchException(int batchIndex, String message, Throwable cause) {
        super(PipelineStage.CATEGORIZATION, "batch " + batchIndex + ": " + message, cause);
        this.batchIndex = batchIndex;
    }

    public int getBatchIndex() {
        return batchIndex;
    }
}
