package com.ledgerlens.backend.exceptions;

// Never escapes the mapper: it falls back to keyword matching.
public class SemanticMappingException extends PipelineException {

    public SemanticMappingException(String message) {
        super(PipelineStage.SEMANTIC_MAPPING, message);
    }

    public SemanticMappingException(String message, Throwable cause) {
        super(PipelineStage.SEMANTIC_MAPPING, message, cause);
    }
}
