package com.ledgerlens.backend.services.statements.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Where the transaction date lives, how to parse it, and how amounts are encoded.
 *
 * @param dateColumn source column holding the transaction date
 * @param dateFormat Java {@code DateTimeFormatter} pattern or strftime string
 * @param amount     amount layout
 */
public record StructuralInfo(String dateColumn, String dateFormat, AmountLayout amount) {

    public StructuralInfo {
        if (dateColumn == null || dateColumn.isBlank()) {
            throw new IllegalArgumentException("date column is required");
        }
        if (dateFormat == null || dateFormat.isBlank()) {
            throw new IllegalArgumentException("date format is required");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount layout is required");
        }
    }

    public AmountRepresentation representation() {
        return amount.representation();
    }

    /** Date column plus every amount-related column. */
    public Set<String> consumedColumns() {
        Set<String> used = new LinkedHashSet<>();
        used.add(dateColumn);
        used.addAll(amount.columns());
        return used;
    }
}
