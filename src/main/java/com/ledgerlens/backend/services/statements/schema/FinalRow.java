package com.ledgerlens.backend.services.statements.schema;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A row of the canonical output table. Components follow the column order of
 * {@link FinalTable#COLUMNS}.
 */
public record FinalRow(
        String description,
        LocalDate transactionDate,
        BigDecimal amount,
        String category,
        String subCategory
) {
    public FinalRow {
        if (description == null || transactionDate == null || amount == null
                || category == null || subCategory == null) {
            throw new IllegalArgumentException("final rows have no null fields");
        }
    }
}
