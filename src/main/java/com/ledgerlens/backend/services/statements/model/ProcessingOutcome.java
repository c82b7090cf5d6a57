package com.ledgerlens.backend.services.statements.model;

import java.util.List;

/**
 * Categorized rows as produced by a processor, before schema enforcement.
 */
public record ProcessingOutcome(List<CategorizedTransaction> transactions, PipelineReport report) {
    public ProcessingOutcome {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
