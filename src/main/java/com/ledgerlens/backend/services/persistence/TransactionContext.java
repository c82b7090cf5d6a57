package com.ledgerlens.backend.services.persistence;

import java.util.UUID;

import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import lombok.extern.slf4j.Slf4j;

/**
 * Handle on one explicit database transaction.
 *
 * <p>Lifecycle: {@code BEGUN -> COMMITTED} or {@code BEGUN -> ROLLED_BACK}. Both end states
 * are terminal; any further use throws {@link IllegalStateException}. Closing a context
 * that is still open rolls it back.</p>
 */
@Slf4j
public final class TransactionContext implements AutoCloseable {

    public enum State {
        BEGUN,
        COMMITTED,
        ROLLED_BACK
    }

    private final UUID id = UUID.randomUUID();
    private final String name;
    private final PlatformTransactionManager transactionManager;
    private final TransactionStatus status;
    private State state = State.BEGUN;

    private TransactionContext(String name, PlatformTransactionManager transactionManager, TransactionStatus status) {
        this.name = name;
        this.transactionManager = transactionManager;
        this.status = status;
    }

    /** Starts a new transaction, suspending any transaction already bound to the thread. */
    public static TransactionContext begin(PlatformTransactionManager transactionManager, String name) {
        DefaultTransactionDefinition definition =
                new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        definition.setName(name);
        TransactionStatus status = transactionManager.getTransaction(definition);
        TransactionContext ctx = new TransactionContext(name, transactionManager, status);
        log.debug("[Tx] begin {} ({})", name, ctx.id);
        return ctx;
    }

    public void commit() {
        ensureActive();
        try {
            transactionManager.commit(status);
            state = State.COMMITTED;
            log.debug("[Tx] commit {} ({})", name, id);
        } catch (RuntimeException e) {
            // a failed commit leaves the transaction rolled back
            state = State.ROLLED_BACK;
            throw e;
        }
    }

    public void rollback() {
        ensureActive();
        try {
            transactionManager.rollback(status);
        } finally {
            state = State.ROLLED_BACK;
            log.debug("[Tx] rollback {} ({})", name, id);
        }
    }

    public void ensureActive() {
        if (state != State.BEGUN) {
            throw new IllegalStateException("transaction " + name + " (" + id + ") is already " + state);
        }
    }

    public boolean isActive() {
        return state == State.BEGUN;
    }

    public State getState() {
        return state;
    }

    public UUID getId() {
        return id;
    }

    @Override
    public void close() {
        if (state == State.BEGUN) {
            rollback();
        }
    }
}
