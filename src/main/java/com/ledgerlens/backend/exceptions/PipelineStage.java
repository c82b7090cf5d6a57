package com.ledgerlens.backend.exceptions;

public enum PipelineStage {
    STRUCTURAL_ANALYSIS("structural analysis"),
    SEMANTIC_MAPPING("semantic mapping"),
    EXTRACTION("row extraction"),
    CATEGORIZATION("categorization"),
    SCHEMA_ENFORCEMENT("schema enforcement"),
    PERSISTENCE("persistence");

    private final String label;

    PipelineStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
