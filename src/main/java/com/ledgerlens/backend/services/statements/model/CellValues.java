package com.ledgerlens.backend.services.statements.model;

public final class CellValues {

    private CellValues() {
    }

    public static boolean isBlank(Object value) {
        if (value == null) return true;
        String s = value.toString().trim();
        return s.isEmpty() || s.equalsIgnoreCase("nan") || s.equalsIgnoreCase("null");
    }

    /** Trimmed text of a cell; blank cells become the empty string. */
    public static String text(Object value) {
        return isBlank(value) ? "" : value.toString().trim();
    }
}
