package com.ledgerlens.backend.services.statements.categorization;

import java.time.Instant;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.config.ImportProperties.HierarchyCachePolicy;
import com.ledgerlens.backend.repositories.CategoryRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Supplies the category hierarchy to categorizers. With {@code hierarchy-cache=TTL} the
 * last snapshot is reused until it expires or a write invalidates it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoryHierarchyProvider {

    private final CategoryRepository categoryRepository;
    private final ImportProperties properties;

    private volatile CachedHierarchy cached;

    public CategoryHierarchy current() {
        boolean caching = properties.hierarchyCache() == HierarchyCachePolicy.TTL;
        if (caching) {
            CachedHierarchy c = cached;
            if (c != null && Instant.now().isBefore(c.expiresAt())) {
                return c.hierarchy();
            }
        }

        CategoryHierarchy fresh = CategoryHierarchy.fromPairs(categoryRepository.findAllPairs());
        log.debug("[CategoryHierarchy] loaded {} top-level categories", fresh.categories().size());
        if (caching) {
            cached = new CachedHierarchy(fresh, Instant.now().plus(properties.hierarchyCacheTtl()));
        }
        return fresh;
    }

    public void invalidate() {
        cached = null;
    }

    private record CachedHierarchy(CategoryHierarchy hierarchy, Instant expiresAt) {
    }
}
