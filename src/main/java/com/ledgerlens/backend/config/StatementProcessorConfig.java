package com.ledgerlens.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.ledgerlens.backend.services.statements.GuardedStatementProcessor;
import com.ledgerlens.backend.services.statements.StagedStatementProcessor;
import com.ledgerlens.backend.services.statements.analysis.AiSemanticMapper;
import com.ledgerlens.backend.services.statements.analysis.AiStructuralAnalyzer;
import com.ledgerlens.backend.services.statements.analysis.FrameSampler;
import com.ledgerlens.backend.services.statements.analysis.HeuristicSemanticMapper;
import com.ledgerlens.backend.services.statements.analysis.HeuristicStructuralAnalyzer;
import com.ledgerlens.backend.services.statements.categorization.BatchCategorizer;
import com.ledgerlens.backend.services.statements.categorization.CategoryHierarchyProvider;
import com.ledgerlens.backend.services.statements.categorization.KeywordCategorizer;
import com.ledgerlens.backend.services.statements.extraction.TransactionExtractor;
import com.ledgerlens.backend.services.statements.schema.SchemaGuard;

/**
 * The two processor variants: model-assisted and rule-based. Both are schema guarded.
 */
@Configuration
public class StatementProcessorConfig {

    @Bean
    public GuardedStatementProcessor aiStatementProcessor(
            FrameSampler sampler,
            AiStructuralAnalyzer structuralAnalyzer,
            AiSemanticMapper semanticMapper,
            TransactionExtractor extractor,
            BatchCategorizer categorizer,
            CategoryHierarchyProvider hierarchyProvider,
            SchemaGuard schemaGuard
    ) {
        return new GuardedStatementProcessor(
                new StagedStatementProcessor("AiStatementProcessor", sampler, structuralAnalyzer, semanticMapper,
                        extractor, categorizer, hierarchyProvider),
                schemaGuard);
    }

    @Bean
    public GuardedStatementProcessor ruleBasedStatementProcessor(
            FrameSampler sampler,
            HeuristicStructuralAnalyzer structuralAnalyzer,
            HeuristicSemanticMapper semanticMapper,
            TransactionExtractor extractor,
            KeywordCategorizer categorizer,
            CategoryHierarchyProvider hierarchyProvider,
            SchemaGuard schemaGuard
    ) {
        return new GuardedStatementProcessor(
                new StagedStatementProcessor("RuleBasedStatementProcessor", sampler, structuralAnalyzer, semanticMapper,
                        extractor, categorizer, hierarchyProvider),
                schemaGuard);
    }
}
