package com.ledgerlens.backend.services.persistence;

import java.util.List;
import java.util.Objects;

/**
 * Result of a chunked save. Committed chunks stay committed when a later chunk fails.
 */
public record ChunkedOperationResult(int rowsSubmitted, List<BatchOutcome> batches) implements OperationResult {

    public ChunkedOperationResult {
        batches = List.copyOf(batches);
    }

    @Override
    public boolean success() {
        return batches.stream().allMatch(BatchOutcome::success);
    }

    @Override
    public int rowsAffected() {
        return batches.stream().mapToInt(BatchOutcome::rowsAffected).sum();
    }

    @Override
    public List<PersistenceError> errors() {
        return batches.stream().map(BatchOutcome::error).filter(Objects::nonNull).toList();
    }

    @Override
    public BatchStrategy strategy() {
        return BatchStrategy.CHUNKED;
    }

    public List<BatchOutcome> failedBatches() {
        return batches.stream().filter(b -> !b.success()).toList();
    }
}
