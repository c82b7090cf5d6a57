package com.ledgerlens.backend.services.statements.categorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class CategoryHierarchyTest {

    @Test
    void fromPairs_groupsChildrenUnderParents() {
        CategoryHierarchy h = CategoryHierarchy.fromPairs(List.of(
                new CategoryPair("Groceries", "Food"),
                new CategoryPair("Food", null),
                new CategoryPair("ATM", null),
                new CategoryPair("Restaurants", "Food"),
                new CategoryPair("Groceries", "Food")));

        assertEquals(List.of("Food", "ATM"), List.copyOf(h.categories()));
        assertEquals(List.of("Groceries", "Restaurants"), h.subCategories("Food"));
        assertTrue(h.subCategories("ATM").isEmpty());
    }

    @Test
    void orphanChild_stillAppearsUnderItsParentName() {
        CategoryHierarchy h = CategoryHierarchy.fromPairs(List.of(new CategoryPair("Rent", "Housing")));

        assertEquals(List.of("Rent"), h.asMap().get("Housing"));
    }

    @Test
    void lookups_areCaseInsensitive() {
        CategoryHierarchy h = CategoryHierarchy.fromPairs(List.of(
                new CategoryPair("Food & Dining", null),
                new CategoryPair("Groceries", "Food & Dining")));

        assertEquals(Optional.of("Food & Dining"), h.canonicalCategory(" food & dining "));
        assertEquals(Optional.of("Groceries"), h.canonicalSubCategory("FOOD & DINING", "groceries"));
        assertEquals(Optional.empty(), h.canonicalCategory("Travel"));
        assertEquals(Optional.empty(), h.canonicalSubCategory("Food & Dining", null));
    }
}
