package com.ledgerlens.backend.services.statements.analysis;

import com.ledgerlens.backend.exceptions.StructuralDiscoveryException;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.StructuralInfo;

public interface StructuralAnalyzer {

    /**
     * Finds the date column, its format, and the amount layout of a statement sample.
     *
     * @throws StructuralDiscoveryException when no consistent structure can be established
     */
    StructuralInfo analyze(RawFrame sample);
}
