package com.ledgerlens.backend.exceptions;

public class InferenceTimeoutException extends InferenceException {

    public InferenceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
