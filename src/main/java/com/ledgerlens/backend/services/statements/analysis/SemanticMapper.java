package com.ledgerlens.backend.services.statements.analysis;

import java.util.Set;

import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.SemanticMapping;

public interface SemanticMapper {

    /**
     * Picks the description column among the columns not already consumed. Never fails:
     * an absent description column is a valid answer.
     */
    SemanticMapping map(RawFrame sample, Set<String> consumedColumns);
}
