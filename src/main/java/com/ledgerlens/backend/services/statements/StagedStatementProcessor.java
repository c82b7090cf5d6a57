package com.ledgerlens.backend.services.statements;

import java.util.List;

import com.ledgerlens.backend.exceptions.StructuralDiscoveryException;
import com.ledgerlens.backend.services.statements.analysis.FrameSampler;
import com.ledgerlens.backend.services.statements.analysis.SemanticMapper;
import com.ledgerlens.backend.services.statements.analysis.StructuralAnalyzer;
import com.ledgerlens.backend.services.statements.categorization.CategorizationResult;
import com.ledgerlens.backend.services.statements.categorization.CategoryHierarchyProvider;
import com.ledgerlens.backend.services.statements.categorization.TransactionCategorizer;
import com.ledgerlens.backend.services.statements.extraction.ExtractionResult;
import com.ledgerlens.backend.services.statements.extraction.TransactionExtractor;
import com.ledgerlens.backend.services.statements.model.PipelineReport;
import com.ledgerlens.backend.services.statements.model.ProcessingOutcome;
import com.ledgerlens.backend.services.statements.model.ProgressListener;
import com.ledgerlens.backend.services.statements.model.RawFrame;
import com.ledgerlens.backend.services.statements.model.SemanticMapping;
import com.ledgerlens.backend.services.statements.model.StructuralInfo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Structural analysis, semantic mapping, extraction and categorization, in that order.
 * Structural failures abort; everything after degrades per row or per batch.
 *
 * <p>Progress: 0.33 after structural analysis, 0.66 after semantic mapping, then the
 * categorizer's own progress scaled onto the remaining third.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class StagedStatementProcessor implements StatementProcessor {

    private final String name;
    private final FrameSampler sampler;
    private final StructuralAnalyzer structuralAnalyzer;
    private final SemanticMapper semanticMapper;
    private final TransactionExtractor extractor;
    private final TransactionCategorizer categorizer;
    private final CategoryHierarchyProvider hierarchyProvider;

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProcessingOutcome process(RawFrame frame, ProgressListener progress) {
        ProgressListener listener = ProgressListener.orNoop(progress);
        if (frame == null || frame.isEmpty()) {
            throw new StructuralDiscoveryException("input has no rows");
        }
        log.info("[{}] Processing {} rows x {} columns", name, frame.rowCount(), frame.columnNames().size());

        RawFrame sample = sampler.sample(frame);
        StructuralInfo info = structuralAnalyzer.analyze(sample);
        listener.onProgress(0.33, "structural analysis complete");

        SemanticMapping mapping = semanticMapper.map(sample, info.consumedColumns());
        listener.onProgress(0.66, "semantic mapping complete");

        ExtractionResult extracted = extractor.extract(frame, info, mapping);

        CategorizationResult categorized;
        if (extracted.transactions().isEmpty()) {
            categorized = new CategorizationResult(List.of(), 0, List.of());
            listener.onProgress(1.0, "no rows to categorize");
        } else {
            categorized = categorizer.categorize(extracted.transactions(), hierarchyProvider.current(),
                    listener.scaled(0.66, 1.0));
        }

        PipelineReport report = new PipelineReport(
                frame.rowCount(),
                categorized.transactions().size(),
                extracted.droppedRows(),
                extracted.warnings(),
                categorized.defaultedRows(),
                categorized.failedBatches(),
                info,
                mapping);
        log.info("[{}] {}", name, report.summary());
        return new ProcessingOutcome(categorized.transactions(), report);
    }
}
