package com.ledgerlens.backend.services.statements.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A row after extraction. {@code amount} is signed: negative means money out.
 */
public record NormalizedTransaction(
        int sourceRow,
        String description,
        LocalDate transactionDate,
        BigDecimal amount
) {
    public NormalizedTransaction {
        if (description == null) {
            description = "";
        }
        if (transactionDate == null) {
            throw new IllegalArgumentException("transactionDate is required");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
    }
}
