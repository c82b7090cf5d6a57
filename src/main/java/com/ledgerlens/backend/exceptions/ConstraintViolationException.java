package com.ledgerlens.backend.exceptions;

/**
 * A row was rejected by the database. Not retryable: the data has to change first.
 */
public class ConstraintViolationException extends PersistenceException {

    private final Integer rowIndex;
    private final ConstraintKind kind;

    public ConstraintViolationException(Integer rowIndex, ConstraintKind kind, String message, Throwable cause) {
        super(kind + " constraint violated" + (rowIndex != null ? " at row " + rowIndex : "") + ": " + message, cause);
        this.rowIndex = rowIndex;
        this.kind = kind;
    }

    public Integer getRowIndex() {
        return rowIndex;
    }

    public ConstraintKind getKind() {
        return kind;
    }
}
