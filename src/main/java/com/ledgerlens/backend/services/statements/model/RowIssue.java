package com.ledgerlens.backend.services.statements.model;

/**
 * Something noteworthy about one input row: either why it was dropped or a warning.
 */
public record RowIssue(int rowIndex, String message) {
}
