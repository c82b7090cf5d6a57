package com.ledgerlens.backend.services.statements.schema;

import java.util.List;

/**
 * The canonical pipeline output: exactly five columns, in a fixed order.
 */
public record FinalTable(List<FinalRow> rows) {

    public static final List<String> COLUMNS =
            List.of("description", "transaction_date", "amount", "category", "sub_category");

    public FinalTable {
        rows = List.copyOf(rows);
    }

    public static FinalTable empty() {
        return new FinalTable(List.of());
    }

    public List<String> columns() {
        return COLUMNS;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public FinalRow row(int index) {
        return rows.get(index);
    }

    /** Rows {@code [from, to)} as their own table. */
    public FinalTable slice(int from, int to) {
        return new FinalTable(rows.subList(from, to));
    }
}
