package com.ledgerlens.backend.exceptions;

public class SchemaViolationException extends PipelineException {

    private final String column;
    private final Integer rowIndex;

    public SchemaViolationException(String column, Integer rowIndex, String message) {
        super(PipelineStage.SCHEMA_ENFORCEMENT, describe(column, rowIndex, message));
        this.column = column;
        this.rowIndex = rowIndex;
    }

    public String getColumn() {
        return column;
    }

    public Integer getRowIndex() {
        return rowIndex;
    }

    private static String describe(String column, Integer rowIndex, String message) {
        StringBuilder sb = new StringBuilder();
        if (column != null) {
            sb.append("column '").append(column).append("' ");
        }
        if (rowIndex != null) {
            sb.append("row ").append(rowIndex).append(' ');
        }
        return sb.append(message).toString();
    }
}
