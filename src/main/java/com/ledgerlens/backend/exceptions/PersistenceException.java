package com.ledgerlens.backend.exceptions;

public abstract class PersistenceException extends PipelineException {

    protected PersistenceException(String message, Throwable cause) {
        super(PipelineStage.PERSISTENCE, message, cause);
    }
}
