package com.ledgerlens.backend.services.statements.extraction;

import java.util.List;

import com.ledgerlens.backend.services.statements.model.NormalizedTransaction;
import com.ledgerlens.backend.services.statements.model.RowIssue;

public record ExtractionResult(
        List<NormalizedTransaction> transactions,
        List<RowIssue> droppedRows,
        List<RowIssue> warnings,
        int inputRows
) {
    public ExtractionResult {
        transactions = List.copyOf(transactions);
        droppedRows = List.copyOf(droppedRows);
        warnings = List.copyOf(warnings);
    }
}
