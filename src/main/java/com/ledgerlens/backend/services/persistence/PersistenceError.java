package com.ledgerlens.backend.services.persistence;

import com.ledgerlens.backend.exceptions.ConstraintKind;

/**
 * Classified database failure.
 *
 * @param rowIndex       index in the submitted table, when the failing row is known
 * @param kind           error family
 * @param constraintKind which constraint, for {@link ErrorKind#CONSTRAINT_VIOLATION}
 * @param retryable      whether repeating the same call may succeed
 */
public record PersistenceError(
        Integer rowIndex,
        ErrorKind kind,
        ConstraintKind constraintKind,
        boolean retryable,
        String message
) {
    public enum ErrorKind {
        CONSTRAINT_VIOLATION,
        CONNECTIVITY,
        UNKNOWN
    }

    public PersistenceError withRowIndex(Integer index) {
        return new PersistenceError(index, kind, constraintKind, retryable, message);
    }
}
