package com.ledgerlens.backend.services.persistence;

import static com.ledgerlens.backend.services.persistence.PersistenceFixtures.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.entities.Category;
import com.ledgerlens.backend.entities.LedgerTransaction;
import com.ledgerlens.backend.exceptions.ConnectivityException;
import com.ledgerlens.backend.exceptions.ConstraintKind;
import com.ledgerlens.backend.repositories.LedgerTransactionRepository;
import com.ledgerlens.backend.services.persistence.OperationResult.BatchStrategy;
import com.ledgerlens.backend.services.statements.categorization.CategoryHierarchyProvider;

@ExtendWith(MockitoExtension.class)
class TransactionCoordinatorTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TransactionStatus status;

    @Mock
    private LedgerTransactionRepository transactionRepository;

    @Mock
    private CategoryResolver categoryResolver;

    @Mock
    private CategoryHierarchyProvider hierarchyProvider;

    private TransactionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        // small < 2 rows, medium <= 4 rows, chunks of 2
        ImportProperties properties = new ImportProperties(null, null, null, null, null, null, null, null,
                null, null, 2, 4, 2, null);
        coordinator = new TransactionCoordinator(transactionManager, transactionRepository, categoryResolver,
                new PersistenceErrorClassifier(), hierarchyProvider, properties);
    }

    private void stubTransactions() {
        when(transactionManager.getTransaction(any())).thenReturn(status);
        when(categoryResolver.resolve(anyString(), anyString(), any())).thenReturn(new Category("Groceries", null));
    }

    private void rejectDescription(String description, String sqlState) {
        when(transactionRepository.saveAndFlush(any())).thenAnswer(inv -> {
            LedgerTransaction tx = inv.getArgument(0);
            if (description.equals(tx.getDescription())) {
                throw new DataIntegrityViolationException("rejected", new SQLException("rejected", sqlState));
            }
            return tx;
        });
    }

    @Test
    void emptyTable_touchesNothing() {
        OperationResult result = coordinator.saveBatch(table(0));

        assertTrue(result.success());
        assertEquals(0, result.rowsAffected());
        verifyNoInteractions(transactionManager, transactionRepository);
    }

    @Test
    void smallBatch_isOneTransactionWithOneFlush() {
        stubTransactions();

        OperationResult result = coordinator.saveBatch(table(1));

        assertTrue(result.success());
        assertEquals(BatchStrategy.SINGLE_TRANSACTION, result.strategy());
        verify(transactionRepository).save(any(LedgerTransaction.class));
        verify(transactionRepository).flush();
        verify(transactionManager).commit(status);
        verify(hierarchyProvider).invalidate();
    }

    @Test
    void lockTimeout_isThrownAsRetryable_afterRollback() {
        stubTransactions();
        doThrow(new CannotAcquireLockException("lock wait timeout")).when(transactionRepository).flush();

        ConnectivityException ex = assertThrows(ConnectivityException.class, () -> coordinator.saveBatch(table(1)));

        assertTrue(ex.isRetryable());
        verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(any());
        verify(hierarchyProvider, never()).invalidate();
    }

    @Test
    void trackedBatch_namesTheFailingRow_andStoresNothing() {
        stubTransactions();
        rejectDescription("bad", "23502");

        OperationResult result = coordinator.saveBatch(table(3, 1, "bad"));

        BatchOperationResult batch = assertInstanceOf(BatchOperationResult.class, result);
        assertFalse(batch.success());
        assertEquals(BatchStrategy.TRACKED_TRANSACTION, batch.strategy());
        assertEquals(0, batch.rowsAffected());
        assertEquals(List.of(1), batch.failedRowIndices());
        assertEquals(ConstraintKind.NOT_NULL, batch.errors().get(0).constraintKind());
        verify(transactionManager).rollback(status);
    }

    @Test
    void chunkedBatch_isolatesTheFailingChunk() {
        stubTransactions();
        rejectDescription("bad", "23505");

        OperationResult result = coordinator.saveBatch(table(5, 2, "bad"));

        ChunkedOperationResult chunked = assertInstanceOf(ChunkedOperationResult.class, result);
        assertFalse(chunked.success());
        assertEquals(3, chunked.batches().size());
        assertEquals(3, chunked.rowsAffected());

        BatchOutcome failed = chunked.failedBatches().get(0);
        assertEquals(1, failed.batchIndex());
        assertEquals(2, failed.firstRow());
        assertEquals(List.of(2), failed.failedRowIndices());
        assertEquals(ConstraintKind.UNIQUE, failed.error().constraintKind());

        verify(transactionManager, times(2)).commit(status);
        verify(transactionManager, times(1)).rollback(status);
        verify(hierarchyProvider, times(2)).invalidate();
    }
}
