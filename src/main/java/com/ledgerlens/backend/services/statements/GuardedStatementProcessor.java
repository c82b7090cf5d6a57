package com.ledgerlens.backend.services.statements;

import com.ledgerlens.backend.services.statements.model.ProcessingOutcome;
import com.ledgerlens.backend.services.statements.model.ProgressListener;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.schema.SchemaGuard;

/**
 * Entry point for a processor variant: runs it, then normalizes whatever it returned.
 */
public class GuardedStatementProcessor {

    private final StatementProcessor delegate;
    private final SchemaGuard schemaGuard;

    public GuardedStatementProcessor(StatementProcessor delegate, SchemaGuard schemaGuard) {
        this.delegate = delegate;
        this.schemaGuard = schemaGuard;
    }

    public PipelineResult process(RawFrame frame, ProgressListener progress) {
        ProcessingOutcome outcome = delegate.process(frame, progress);
        return new PipelineResult(schemaGuard.enforce(outcome.transactions()), outcome.report());
    }

    public String name() {
        return delegate.name();
    }
}
