package com.ledgerlens.backend.services.statements.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CategorizedTransaction(
        int sourceRow,
        String description,
        LocalDate transactionDate,
        BigDecimal amount,
        String category,
        String subCategory
) {
    public static final String UNCATEGORIZED = "Uncategorized";

    public static CategorizedTransaction of(NormalizedTransaction tx, String category, String subCategory) {
        return new CategorizedTransaction(tx.sourceRow(), tx.description(), tx.transactionDate(), tx.amount(),
                category, subCategory);
    }

    public static CategorizedTransaction uncategorized(NormalizedTransaction tx) {
        return of(tx, UNCATEGORIZED, "");
    }
}
