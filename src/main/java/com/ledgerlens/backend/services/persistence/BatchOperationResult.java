package com.ledgerlens.backend.services.persistence;

import java.util.List;
import java.util.Objects;

/**
 * Result of an all-or-nothing save. On failure nothing was stored and {@link #errors()}
 * names the offending rows where they could be identified.
 */
public record BatchOperationResult(
        BatchStrategy strategy,
        int rowsSubmitted,
        int rowsAffected,
        List<PersistenceError> errors
) implements OperationResult {

    public BatchOperationResult {
        errors = List.copyOf(errors);
    }

    public static BatchOperationResult committed(BatchStrategy strategy, int rows) {
        return new BatchOperationResult(strategy, rows, rows, List.of());
    }

    public static BatchOperationResult rolledBack(BatchStrategy strategy, int rows, List<PersistenceError> errors) {
        return new BatchOperationResult(strategy, rows, 0, errors);
    }

    @Override
    public boolean success() {
        return errors.isEmpty() && rowsAffected == rowsSubmitted;
    }

    public List<Integer> failedRowIndices() {
        return errors.stream().map(PersistenceError::rowIndex).filter(Objects::nonNull).toList();
    }
}
