package com.ledgerlens.backend.exceptions;

public enum ConstraintKind {
    UNIQUE,
    FOREIGN_KEY,
    NOT_NULL,
    CHECK,
    /** Value does not fit the column (too long, out of range, bad format). */
    DATA,
    OTHER
}
