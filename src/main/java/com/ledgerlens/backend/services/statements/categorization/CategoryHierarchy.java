package com.ledgerlens.backend.services.statements.categorization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only, two-level view of the category table: top-level category to its
 * sub-categories. Lookups by name are case-insensitive.
 */
public final class CategoryHierarchy {

    private static final CategoryHierarchy EMPTY = new CategoryHierarchy(Map.of());

    private final Map<String, List<String>> tree;

    private CategoryHierarchy(Map<String, List<String>> tree) {
        this.tree = tree;
    }

    public static CategoryHierarchy empty() {
        return EMPTY;
    }

    public static CategoryHierarchy fromPairs(Collection<CategoryPair> pairs) {
        Map<String, List<String>> tree = new LinkedHashMap<>();
        for (CategoryPair p : pairs) {
            if (p.parentName() == null) {
                tree.computeIfAbsent(p.name(), k -> new ArrayList<>());
            }
        }
        for (CategoryPair p : pairs) {
            if (p.parentName() != null) {
                List<String> children = tree.computeIfAbsent(p.parentName(), k -> new ArrayList<>());
                if (!children.contains(p.name())) {
                    children.add(p.name());
                }
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        tree.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new CategoryHierarchy(Collections.unmodifiableMap(frozen));
    }

    public Set<String> categories() {
        return tree.keySet();
    }

    public List<String> subCategories(String category) {
        return canonicalCategory(category).map(tree::get).orElse(List.of());
    }

    public boolean isEmpty() {
        return tree.isEmpty();
    }

    /** Ordered map view, suitable for JSON serialization into prompts. */
    public Map<String, List<String>> asMap() {
        return tree;
    }

    public Optional<String> canonicalCategory(String name) {
        if (name == null) return Optional.empty();
        String wanted = name.trim();
        if (tree.containsKey(wanted)) return Optional.of(wanted);
        String lower = wanted.toLowerCase(Locale.ROOT);
        return tree.keySet().stream().filter(k -> k.toLowerCase(Locale.ROOT).equals(lower)).findFirst();
    }

    public Optional<String> canonicalSubCategory(String category, String subCategory) {
        if (subCategory == null) return Optional.empty();
        String lower = subCategory.trim().toLowerCase(Locale.ROOT);
        return subCategories(category).stream().filter(s -> s.toLowerCase(Locale.ROOT).equals(lower)).findFirst();
    }

    @Override
    public String toString() {
        return "CategoryHierarchy" + tree;
    }
}
