package com.ledgerlens.backend.exceptions;

/**
 * Transient database failure (lost connection, lock timeout, deadlock). The transaction
 * was rolled back and the same call may be retried.
 */
public class ConnectivityException extends PersistenceException {

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
