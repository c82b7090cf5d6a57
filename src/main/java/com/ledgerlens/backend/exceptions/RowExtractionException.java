package com.ledgerlens.backend.exceptions;

/**
 * A single row could not be normalized. The extractor drops the row and reports it.
 */
public class RowExtractionException extends PipelineException {

    private final int rowIndex;

    public RowExtractionException(int rowIndex, String message) {
        super(PipelineStage.EXTRACTION, "row " + rowIndex + ": " + message);
        this.rowIndex = rowIndex;
    }

    public int getRowIndex() {
        return rowIndex;
    }
}
