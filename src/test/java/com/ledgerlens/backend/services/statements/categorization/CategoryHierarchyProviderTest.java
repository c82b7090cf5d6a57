package com.ledgerlens.backend.services.statements.categorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.config.ImportProperties.HierarchyCachePolicy;
import com.ledgerlens.backend.repositories.CategoryRepository;

@ExtendWith(MockitoExtension.class)
class CategoryHierarchyProviderTest {

    @Mock
    private CategoryRepository categoryRepository;

    @BeforeEach
    void setUp() {
        when(categoryRepository.findAllPairs()).thenReturn(List.of(
                new CategoryPair("Income", null), new CategoryPair("Salary", "Income")));
    }

    private static ImportProperties cache(HierarchyCachePolicy policy) {
        return new ImportProperties(null, null, null, null, null, null, policy, Duration.ofMinutes(5),
                null, null, null, null, null, null);
    }

    @Test
    void noCache_readsTheTableEveryTime() {
        CategoryHierarchyProvider provider = new CategoryHierarchyProvider(categoryRepository, cache(HierarchyCachePolicy.NONE));

        provider.current();
        CategoryHierarchy second = provider.current();

        assertEquals(List.of("Salary"), second.subCategories("Income"));
        verify(categoryRepository, times(2)).findAllPairs();
    }

    @Test
    void ttlCache_reusesSnapshotUntilInvalidated() {
        CategoryHierarchyProvider provider = new CategoryHierarchyProvider(categoryRepository, cache(HierarchyCachePolicy.TTL));

        CategoryHierarchy first = provider.current();
        assertSame(first, provider.current());
        verify(categoryRepository, times(1)).findAllPairs();

        provider.invalidate();
        provider.current();
        verify(categoryRepository, times(2)).findAllPairs();
    }
}
