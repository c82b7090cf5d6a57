package com.ledgerlens.backend.services.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;

@ExtendWith(MockitoExtension.class)
class TransactionContextTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TransactionStatus status;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(status);
    }

    @Test
    void begin_startsAnIndependentNamedTransaction() {
        TransactionContext.begin(transactionManager, "save-batch");

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertEquals(TransactionDefinition.PROPAGATION_REQUIRES_NEW, definition.getValue().getPropagationBehavior());
        assertEquals("save-batch", definition.getValue().getName());
    }

    @Test
    void commit_isTerminal() {
        TransactionContext ctx = TransactionContext.begin(transactionManager, "t");

        ctx.commit();

        assertEquals(TransactionContext.State.COMMITTED, ctx.getState());
        assertThrows(IllegalStateException.class, ctx::commit);
        assertThrows(IllegalStateException.class, ctx::rollback);
        assertThrows(IllegalStateException.class, ctx::ensureActive);
        verify(transactionManager).commit(status);
    }

    @Test
    void failedCommit_leavesContextRolledBack() {
        doThrow(new TransactionSystemException("commit failed")).when(transactionManager).commit(status);
        TransactionContext ctx = TransactionContext.begin(transactionManager, "t");

        assertThrows(TransactionSystemException.class, ctx::commit);

        assertEquals(TransactionContext.State.ROLLED_BACK, ctx.getState());
        assertFalse(ctx.isActive());
    }

    @Test
    void close_rollsBackOnlyOpenContexts() {
        TransactionContext committed = TransactionContext.begin(transactionManager, "done");
        committed.commit();
        committed.close();
        assertEquals(TransactionContext.State.COMMITTED, committed.getState());
        verify(transactionManager, never()).rollback(any(TransactionStatus.class));

        TransactionContext open = TransactionContext.begin(transactionManager, "open");
        open.close();
        assertEquals(TransactionContext.State.ROLLED_BACK, open.getState());
        verify(transactionManager).rollback(status);
    }
}
