package com.ledgerlens.backend.exceptions;

public class StructuralDiscoveryException extends PipelineException {

    public StructuralDiscoveryException(String message) {
        super(PipelineStage.STRUCTURAL_ANALYSIS, message);
    }

    public StructuralDiscoveryException(String message, Throwable cause) {
        super(PipelineStage.STRUCTURAL_ANALYSIS, message, cause);
    }
}
