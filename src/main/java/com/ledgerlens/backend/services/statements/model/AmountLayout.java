package com.ledgerlens.backend.services.statements.model;

import java.util.List;

/**
 * Exactly one of three shapes; each shape carries only the columns it needs.
 */
public sealed interface AmountLayout
        permits AmountLayout.DualColumn, AmountLayout.SignedColumn, AmountLayout.TypeIndicator {

    AmountRepresentation representation();

    /** Source columns this layout reads. */
    List<String> columns();

    record DualColumn(String debitColumn, String creditColumn) implements AmountLayout {
        public DualColumn {
            requireText(debitColumn, "debit_column");
            requireText(creditColumn, "credit_column");
            if (debitColumn.equals(creditColumn)) {
                throw new IllegalArgumentException("debit_column and credit_column must differ");
            }
        }

        @Override
        public AmountRepresentation representation() {
            return AmountRepresentation.DUAL_COLUMN_DEBIT_CREDIT;
        }

        @Override
        public List<String> columns() {
            return List.of(debitColumn, creditColumn);
        }
    }

    record SignedColumn(String amountColumn) implements AmountLayout {
        public SignedColumn {
            requireText(amountColumn, "amount_column");
        }

        @Override
        public AmountRepresentation representation() {
            return AmountRepresentation.SINGLE_COLUMN_SIGNED;
        }

        @Override
        public List<String> columns() {
            return List.of(amountColumn);
        }
    }

    record TypeIndicator(String amountColumn, String typeColumn, String debitIdentifier, String creditIdentifier)
            implements AmountLayout {
        public TypeIndicator {
            requireText(amountColumn, "amount_column");
            requireText(typeColumn, "type_column");
            requireText(debitIdentifier, "debit_identifier");
            requireText(creditIdentifier, "credit_identifier");
            if (debitIdentifier.trim().equalsIgnoreCase(creditIdentifier.trim())) {
                throw new IllegalArgumentException("debit_identifier and credit_identifier must differ");
            }
        }

        @Override
        public AmountRepresentation representation() {
            return AmountRepresentation.SINGLE_COLUMN_WITH_TYPE;
        }

        @Override
        public List<String> columns() {
            return List.of(amountColumn, typeColumn);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
