package com.ledgerlens.backend.services.persistence;

import java.util.List;

/**
 * Outcome of a save call.
 */
public interface OperationResult {

    /** Whether every submitted row is now stored. */
    boolean success();

    int rowsSubmitted();

    int rowsAffected();

    List<PersistenceError> errors();

    BatchStrategy strategy();

    enum BatchStrategy {
        /** Fewer than the small-batch limit: one transaction, one flush. */
        SINGLE_TRANSACTION,
        /** Up to the medium-batch limit: one transaction, failing rows identified. */
        TRACKED_TRANSACTION,
        /** Larger: independent chunks, each committed on its own. */
        CHUNKED
    }
}
