package com.ledgerlens.backend.services.statements.categorization;

import java.util.List;

import com.ledgerlens.backend.services.statements.model.CategorizedTransaction;

/**
 * @param transactions  same length and order as the input
 * @param defaultedRows rows that fell back to "Uncategorized"
 * @param failedBatches zero-based indices of batches that exhausted their retries
 */
public record CategorizationResult(
        List<CategorizedTransaction> transactions,
        int defaultedRows,
        List<Integer> failedBatches
) {
    public CategorizationResult {
        transactions = List.copyOf(transactions);
        failedBatches = List.copyOf(failedBatches);
    }
}
