package com.ledgerlens.backend.services.statements.model;

import java.util.List;

/**
 * What happened to the input during one pipeline run.
 */
public record PipelineReport(
        int inputRows,
        int outputRows,
        List<RowIssue> droppedRows,
        List<RowIssue> warnings,
        int defaultedRows,
        List<Integer> failedBatches,
        StructuralInfo structuralInfo,
        SemanticMapping semanticMapping
) {
    public PipelineReport {
        droppedRows = droppedRows == null ? List.of() : List.copyOf(droppedRows);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        failedBatches = failedBatches == null ? List.of() : List.copyOf(failedBatches);
    }

    public String summary() {
        return String.format("%d of %d rows processed, %d defaulted, %d dropped",
                outputRows, inputRows, defaultedRows, droppedRows.size());
    }
}
