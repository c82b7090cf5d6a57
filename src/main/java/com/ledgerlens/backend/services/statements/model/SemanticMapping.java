package com.ledgerlens.backend.services.statements.model;

/**
 * @param descriptionColumn the column holding the transaction narrative, or {@code null}
 *                          when descriptions must be built from the leftover columns
 */
public record SemanticMapping(String descriptionColumn) {

    public static SemanticMapping none() {
        return new SemanticMapping(null);
    }

    public boolean hasDescriptionColumn() {
        return descriptionColumn != null;
    }
}
