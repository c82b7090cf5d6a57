package com.ledgerlens.backend.services.statements.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Untyped tabular input: ordered, named columns of equal length. Cell values are
 * whatever the upstream reader produced (usually strings, sometimes numbers or dates)
 * and may be {@code null}.
 */
public final class RawFrame {

    private final Map<String, List<Object>> columns;
    private final int rowCount;

    private RawFrame(Map<String, List<Object>> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static RawFrame of(Map<String, ? extends List<?>> source) {
        if (source == null) {
            throw new IllegalArgumentException("frame columns are required");
        }
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        int rows = -1;
        for (Map.Entry<String, ? extends List<?>> e : source.entrySet()) {
            String name = e.getKey();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("column names must not be blank");
            }
            List<?> values = e.getValue() == null ? List.of() : e.getValue();
            if (rows >= 0 && values.size() != rows) {
                throw new IllegalArgumentException("column '" + name + "' has " + values.size()
                        + " values, expected " + rows);
            }
            rows = values.size();
            copy.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        }
        return new RawFrame(Collections.unmodifiableMap(copy), Math.max(rows, 0));
    }

    /** Builds a frame from row maps; the column order follows the first row. */
    public static RawFrame fromRows(List<? extends Map<String, ?>> rows) {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        if (rows != null && !rows.isEmpty()) {
            for (String name : rows.get(0).keySet()) {
                cols.put(name, new ArrayList<>());
            }
            for (Map<String, ?> row : rows) {
                for (Map.Entry<String, List<Object>> c : cols.entrySet()) {
                    c.getValue().add(row.get(c.getKey()));
                }
            }
        }
        return of(cols);
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return name != null && columns.containsKey(name);
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0 || columns.isEmpty();
    }

    public List<Object> column(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("unknown column: " + name);
        }
        return values;
    }

    public Object value(String column, int row) {
        return column(column).get(row);
    }

    public Map<String, Object> row(int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
            row.put(e.getKey(), e.getValue().get(index));
        }
        return row;
    }

    /** New frame holding only the given rows, in the given order. */
    public RawFrame selectRows(List<Integer> indices) {
        Map<String, List<Object>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> e : columns.entrySet()) {
            List<Object> values = new ArrayList<>(indices.size());
            for (Integer i : indices) {
                values.add(e.getValue().get(i));
            }
            out.put(e.getKey(), values);
        }
        return of(out);
    }

    /** Renders the frame as CSV text, header first, for model prompts. */
    public String toCsv() {
        StringBuilder sb = new StringBuilder();
        List<String> names = columnNames();
        appendCsvLine(sb, new ArrayList<>(names));
        for (int r = 0; r < rowCount; r++) {
            List<Object> line = new ArrayList<>(names.size());
            for (String name : names) {
                line.add(columns.get(name).get(r));
            }
            appendCsvLine(sb, line);
        }
        return sb.toString();
    }

    private static void appendCsvLine(StringBuilder sb, List<?> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            Object v = values.get(i);
            String s = v == null ? "" : v.toString();
            if (s.indexOf(',') >= 0 || s.indexOf('"') >= 0 || s.indexOf('\n') >= 0) {
                sb.append('"').append(s.replace("\"", "\"\"")).append('"');
            } else {
                sb.append(s);
            }
        }
        sb.append('\n');
    }
}
