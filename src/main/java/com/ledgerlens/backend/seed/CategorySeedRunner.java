package com.ledgerlens.backend.seed;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.backend.repositories.CategoryRepository;
import com.ledgerlens.backend.services.persistence.TransactionContext;
import com.ledgerlens.backend.services.persistence.TransactionCoordinator;
import com.ledgerlens.backend.services.statements.categorization.CategoryHierarchyProvider;

/**
 * Loads the default category tree on first start. Does nothing once any category exists.
 */
@Component
@ConditionalOnProperty(name = "ledger.seed.enabled", havingValue = "true")
public class CategorySeedRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(CategorySeedRunner.class);

    static final String DEFAULT_CATEGORIES = "seed/default-categories.json";

    private final CategoryRepository categoryRepository;
    private final TransactionCoordinator transactionCoordinator;
    private final CategoryHierarchyProvider hierarchyProvider;
    private final ObjectMapper objectMapper;

    public CategorySeedRunner(CategoryRepository categoryRepository,
                              TransactionCoordinator transactionCoordinator,
                              CategoryHierarchyProvider hierarchyProvider,
                              ObjectMapper objectMapper) {
        this.categoryRepository = categoryRepository;
        this.transactionCoordinator = transactionCoordinator;
        this.hierarchyProvider = hierarchyProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (categoryRepository.count() > 0) {
            logger.info("[Seed] Categories already present. Skipping.");
            return;
        }
        int created = seed(loadDefaults());
        logger.info("[Seed] Default categories ensured: {} entries", created);
    }

    /**
     * Resolves every (category, sub-category) pair in one transaction.
     *
     * @return number of pairs processed
     */
    public int seed(Map<String, List<String>> tree) {
        int processed = 0;
        TransactionContext ctx = transactionCoordinator.begin("seed-categories");
        try (ctx) {
            for (Map.Entry<String, List<String>> e : tree.entrySet()) {
                List<String> children = e.getValue() == null ? List.of() : e.getValue();
                if (children.isEmpty()) {
                    transactionCoordinator.resolveOrCreateCategory(e.getKey(), "", ctx);
                    processed++;
                }
                for (String child : children) {
                    transactionCoordinator.resolveOrCreateCategory(e.getKey(), child, ctx);
                    processed++;
                }
            }
            ctx.commit();
        }
        hierarchyProvider.invalidate();
        return processed;
    }

    Map<String, List<String>> loadDefaults() {
        try (InputStream in = new ClassPathResource(DEFAULT_CATEGORIES).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, List<String>>>() { });
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + DEFAULT_CATEGORIES, e);
        }
    }
}
