package com.ledgerlens.backend.services.persistence;

import java.util.List;

/**
 * One chunk of a chunked save.
 *
 * @param firstRow index of the chunk's first row in the submitted table
 */
public record BatchOutcome(
        int batchIndex,
        int firstRow,
        int rowCount,
        boolean success,
        int rowsAffected,
        PersistenceError error
) {
    public List<Integer> failedRowIndices() {
        return error != null && error.rowIndex() != null ? List.of(error.rowIndex()) : List.of();
    }
}
