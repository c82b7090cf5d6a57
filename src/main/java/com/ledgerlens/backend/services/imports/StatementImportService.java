package com.ledgerlens.backend.services.imports;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.config.ImportProperties.ProcessingMode;
import com.ledgerlens.backend.exceptions.ConnectivityException;
import com.ledgerlens.backend.services.persistence.OperationResult;
import com.ledgerlens.backend.services.persistence.TransactionCoordinator;
import com.ledgerlens.backend.services.statements.GuardedStatementProcessor;
import com.ledgerlens.backend.services.statements.PipelineResult;
import com.ledgerlens.backend.services.statements.model.ProgressListener;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.schema.FinalTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a statement through a processor and stores the result. Connectivity failures
 * while saving are retried with exponential backoff; constraint violations are not.
 */
@Slf4j
@Service
public class StatementImportService {

    private final GuardedStatementProcessor aiProcessor;
    private final GuardedStatementProcessor ruleBasedProcessor;
    private final TransactionCoordinator transactionCoordinator;
    private final ImportProperties properties;

    public StatementImportService(
            @Qualifier("aiStatementProcessor") GuardedStatementProcessor aiProcessor,
            @Qualifier("ruleBasedStatementProcessor") GuardedStatementProcessor ruleBasedProcessor,
            TransactionCoordinator transactionCoordinator,
            ImportProperties properties
    ) {
        this.aiProcessor = aiProcessor;
        this.ruleBasedProcessor = ruleBasedProcessor;
        this.transactionCoordinator = transactionCoordinator;
        this.properties = properties;
    }

    public ImportReport importStatement(RawFrame frame, ProcessingMode mode, ProgressListener progress) {
        GuardedStatementProcessor processor = processorFor(mode);
        log.info("[StatementImport] Starting import of {} rows with {}", frame.rowCount(), processor.name());

        PipelineResult result = processor.process(frame, progress);
        SaveAttempt saved = saveWithRetry(result.table());

        ImportReport report = ImportReport.of(processor.name(), result.report(), saved.result(), saved.attempts());
        log.info("[StatementImport] {}", report.summary());
        return report;
    }

    public ImportReport importStatement(RawFrame frame) {
        return importStatement(frame, properties.mode(), ProgressListener.NOOP);
    }

    private GuardedStatementProcessor processorFor(ProcessingMode mode) {
        ProcessingMode effective = mode != null ? mode : properties.mode();
        return effective == ProcessingMode.RULES ? ruleBasedProcessor : aiProcessor;
    }

    private SaveAttempt saveWithRetry(FinalTable table) {
        int maxAttempts = properties.persistenceRetryAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return new SaveAttempt(transactionCoordinator.saveBatch(table), attempt);
            } catch (ConnectivityException e) {
                if (attempt >= maxAttempts) {
                    log.error("[StatementImport] Giving up after {} attempts: {}", attempt, e.getMessage());
                    throw e;
                }
                log.warn("[StatementImport] Save attempt {}/{} failed, retrying: {}", attempt, maxAttempts,
                        e.getMessage());
                sleepBackoff(attempt);
            }
        }
    }

    private void sleepBackoff(int attempt) {
        Duration base = properties.persistenceRetryBackoff();
        if (base.isZero() || base.isNegative()) return;
        long ms = base.toMillis() * (1L << Math.min(attempt - 1, 6));
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private record SaveAttempt(OperationResult result, int attempts) {
    }
}
