package com.ledgerlens.backend.services.statements.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * How a statement encodes money movement. The wire names are what the structural
 * prompt asks the model to answer with.
 */
public enum AmountRepresentation {
    DUAL_COLUMN_DEBIT_CREDIT("dual_column_debit_credit"),
    SINGLE_COLUMN_SIGNED("single_column_signed"),
    SINGLE_COLUMN_WITH_TYPE("single_column_with_type");

    private final String wireName;

    AmountRepresentation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AmountRepresentation fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("amount representation is missing");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(r -> r.wireName.equals(normalized) || r.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown amount representation: " + value));
    }
}
