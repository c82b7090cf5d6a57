package com.ledgerlens.backend.services.imports;

import java.util.List;

import com.ledgerlens.backend.services.persistence.OperationResult;
import com.ledgerlens.backend.services.persistence.PersistenceError;
import com.ledgerlens.backend.services.statements.model.PipelineReport;

/**
 * Everything a caller needs to know about one import: what the pipeline did and what
 * ended up stored.
 */
public record ImportReport(
        String processor,
        PipelineReport pipeline,
        OperationResult.BatchStrategy strategy,
        int rowsStored,
        boolean fullyStored,
        List<PersistenceError> persistenceErrors,
        int persistenceAttempts
) {
    public static ImportReport of(String processor, PipelineReport pipeline, OperationResult saved, int attempts) {
        return new ImportReport(processor, pipeline, saved.strategy(), saved.rowsAffected(), saved.success(),
                saved.errors(), attempts);
    }

    public String summary() {
        return pipeline.summary() + "; " + rowsStored + " stored"
                + (fullyStored ? "" : " (" + persistenceErrors.size() + " persistence errors)");
    }
}
