package com.ledgerlens.backend.services.statements;

import com.ledgerlens.backend.services.statements.model.PipelineReport;
import com.ledgerlens.backend.services.statements.schema.FinalTable;

public record PipelineResult(FinalTable table, PipelineReport report) {
}
