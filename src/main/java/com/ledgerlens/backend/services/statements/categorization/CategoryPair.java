package com.ledgerlens.backend.services.statements.categorization;

/**
 * One stored category and the name of its parent ({@code null} for top-level categories).
 */
public record CategoryPair(String name, String parentName) {
}
