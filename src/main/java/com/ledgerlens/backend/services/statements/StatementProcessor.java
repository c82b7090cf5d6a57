package com.ledgerlens.backend.services.statements;

import com.ledgerlens.backend.services.statements.model.ProcessingOutcome;
import com.ledgerlens.backend.services.statements.model.ProgressListener;
import com.ledgerlens.backend.services.statements.model.RawFrame;

/**
 * Turns a raw statement into categorized rows. Callers go through
 * {@link GuardedStatementProcessor}, which enforces the output schema.
 */
public interface StatementProcessor {

    String name();

    ProcessingOutcome process(RawFrame frame, ProgressListener progress);
}
