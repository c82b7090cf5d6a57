package com.ledgerlens.backend.services.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.entities.Category;
import com.ledgerlens.backend.entities.LedgerTransaction;
import com.ledgerlens.backend.exceptions.ConnectivityException;
import com.ledgerlens.backend.exceptions.ConstraintKind;
import com.ledgerlens.backend.exceptions.ConstraintViolationException;
import com.ledgerlens.backend.exceptions.PersistenceException;
import com.ledgerlens.backend.repositories.LedgerTransactionRepository;
import com.ledgerlens.backend.services.persistence.OperationResult.BatchStrategy;
import com.ledgerlens.backend.services.persistence.PersistenceError.ErrorKind;
import com.ledgerlens.backend.services.statements.categorization.CategoryHierarchyProvider;
import com.ledgerlens.backend.services.statements.schema.FinalRow;
import com.ledgerlens.backend.services.statements.schema.FinalTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores pipeline output with explicit transaction boundaries.
 *
 * <ul>
 *   <li>fewer than {@code small-batch-limit} rows: one transaction, flushed once;</li>
 *   <li>up to {@code medium-batch-limit} rows: one transaction, flushed per row so a
 *       failure names its row; any failure rolls back everything;</li>
 *   <li>more: chunks of {@code chunk-size}, each in its own transaction. A failed chunk
 *       rolls back alone and is reported; earlier chunks stay committed.</li>
 * </ul>
 *
 * <p>Constraint violations come back inside the result. Connectivity failures of an
 * all-or-nothing save are thrown as {@link ConnectivityException} so callers can retry;
 * nothing was committed at that point.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionCoordinator {

    private final PlatformTransactionManager transactionManager;
    private final LedgerTransactionRepository transactionRepository;
    private final CategoryResolver categoryResolver;
    private final PersistenceErrorClassifier errorClassifier;
    private final CategoryHierarchyProvider hierarchyProvider;
    private final ImportProperties properties;

    public TransactionContext begin(String name) {
        try {
            return TransactionContext.begin(transactionManager, name);
        } catch (TransactionException e) {
            throw translate(e, null);
        }
    }

    public UUID resolveOrCreateCategory(String category, String subCategory, TransactionContext ctx) {
        return categoryResolver.resolveOrCreate(category, subCategory, ctx);
    }

    public OperationResult saveBatch(FinalTable table) {
        int n = table.size();
        if (n == 0) {
            return BatchOperationResult.committed(BatchStrategy.SINGLE_TRANSACTION, 0);
        }

        OperationResult result;
        if (n < properties.smallBatchLimit()) {
            result = saveAtomically(table, BatchStrategy.SINGLE_TRANSACTION);
        } else if (n <= properties.mediumBatchLimit()) {
            result = saveAtomically(table, BatchStrategy.TRACKED_TRANSACTION);
        } else {
            result = saveChunked(table);
        }

        if (result.success()) {
            log.info("[TransactionCoordinator] Stored {} rows ({})", result.rowsAffected(), result.strategy());
        } else {
            log.warn("[TransactionCoordinator] Stored {} of {} rows ({}); errors: {}",
                    result.rowsAffected(), n, result.strategy(), result.errors());
        }
        return result;
    }

    private BatchOperationResult saveAtomically(FinalTable table, BatchStrategy strategy) {
        try {
            int stored = writeInTransaction(table, 0, strategy == BatchStrategy.TRACKED_TRANSACTION, "save-batch");
            return BatchOperationResult.committed(strategy, stored);
        } catch (ConstraintViolationException e) {
            return BatchOperationResult.rolledBack(strategy, table.size(), List.of(toError(e)));
        }
    }

    private ChunkedOperationResult saveChunked(FinalTable table) {
        int n = table.size();
        int chunkSize = properties.chunkSize();
        List<BatchOutcome> outcomes = new ArrayList<>();

        for (int b = 0, start = 0; start < n; b++, start += chunkSize) {
            int end = Math.min(n, start + chunkSize);
            try {
                int stored = writeInTransaction(table.slice(start, end), start, true, "save-chunk-" + b);
                outcomes.add(new BatchOutcome(b, start, end - start, true, stored, null));
            } catch (ConstraintViolationException | ConnectivityException e) {
                log.warn("[TransactionCoordinator] Chunk {} (rows {}-{}) rolled back: {}", b, start, end - 1,
                        e.getMessage());
                outcomes.add(new BatchOutcome(b, start, end - start, false, 0, toError(e)));
            }
        }
        return new ChunkedOperationResult(n, outcomes);
    }

    /**
     * Writes every row of {@code table} in one transaction and commits it.
     *
     * @param offset index of the table's first row in the caller's numbering
     */
    private int writeInTransaction(FinalTable table, int offset, boolean trackRows, String name) {
        Map<String, Category> resolved = new HashMap<>();
        int current = -1;

        TransactionContext ctx = begin(name);
        try (ctx) {
            try {
                for (int i = 0; i < table.size(); i++) {
                    current = offset + i;
                    FinalRow row = table.row(i);
                    Category category = resolved.computeIfAbsent(row.category() + '\u0000' + row.subCategory(),
                            k -> categoryResolver.resolve(row.category(), row.subCategory(), ctx));

                    LedgerTransaction entity = toEntity(row, category);
                    if (trackRows) {
                        transactionRepository.saveAndFlush(entity);
                    } else {
                        transactionRepository.save(entity);
                    }
                }
                current = -1;
                transactionRepository.flush();
                ctx.commit();
            } catch (DataAccessException | TransactionException | jakarta.persistence.PersistenceException e) {
                throw translate(e, trackRows && current >= 0 ? current : null);
            }
        }
        hierarchyProvider.invalidate();
        return table.size();
    }

    private PersistenceException translate(RuntimeException e, Integer rowIndex) {
        PersistenceError error = errorClassifier.classify(e, rowIndex);
        if (error.retryable()) {
            return new ConnectivityException(error.message(), e);
        }
        ConstraintKind kind = error.constraintKind() != null ? error.constraintKind() : ConstraintKind.OTHER;
        return new ConstraintViolationException(rowIndex, kind, error.message(), e);
    }

    private static PersistenceError toError(PersistenceException e) {
        if (e instanceof ConstraintViolationException cv) {
            return new PersistenceError(cv.getRowIndex(), ErrorKind.CONSTRAINT_VIOLATION, cv.getKind(), false,
                    e.getMessage());
        }
        return new PersistenceError(null, ErrorKind.CONNECTIVITY, null, true, e.getMessage());
    }

    private static LedgerTransaction toEntity(FinalRow row, Category category) {
        LedgerTransaction tx = new LedgerTransaction();
        tx.setDescription(row.description());
        tx.setTransactionDate(row.transactionDate());
        tx.setAmount(row.amount());
        tx.setCategory(category);
        return tx;
    }
}
