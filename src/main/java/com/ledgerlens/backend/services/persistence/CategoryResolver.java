package com.ledgerlens.backend.services.persistence;

import java.util.UUID;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.entities.Category;
import com.ledgerlens.backend.repositories.CategoryRepository;
import com.ledgerlens.backend.services.statements.model.CategorizedTransaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds or creates categories by name inside an open {@link TransactionContext}.
 * Resolving the same pair twice yields the same id and creates nothing the second time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoryResolver {

    private final CategoryRepository categoryRepository;

    /**
     * @return the id of the sub-category when {@code subCategory} is non-blank, otherwise
     * the id of the top-level category
     */
    public UUID resolveOrCreate(String category, String subCategory, TransactionContext ctx) {
        return resolve(category, subCategory, ctx).getId();
    }

    Category resolve(String category, String subCategory, TransactionContext ctx) {
        ctx.ensureActive();
        String parentName = category == null || category.isBlank()
                ? CategorizedTransaction.UNCATEGORIZED
                : category.trim();

        Category parent = categoryRepository.findFirstByNameAndParentIsNull(parentName)
                .orElseGet(() -> create(parentName, null));

        if (subCategory == null || subCategory.isBlank()) {
            return parent;
        }
        String childName = subCategory.trim();
        return categoryRepository.findFirstByNameAndParent(childName, parent)
                .orElseGet(() -> create(childName, parent));
    }

    private Category create(String name, Category parent) {
        Category created = categoryRepository.save(new Category(name, parent));
        log.info("[CategoryResolver] Created category '{}'{}", name,
                parent != null ? " under '" + parent.getName() + "'" : "");
        return created;
    }
}
