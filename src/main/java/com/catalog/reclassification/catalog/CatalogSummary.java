package com.catalog.reclassification.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Size figures of a catalog snapshot.
 *
 * @param categories      number of distinct owning categories
 * @param originalLabels  number of distinct original labels
 * @param canonicalLabels number of distinct canonical labels
 * @param mappings        number of entries
 * @param perCategory     breakdown per owning category, sorted by category name
 */
public record CatalogSummary(
        int categories,
        int originalLabels,
        int canonicalLabels,
        int mappings,
        Map<String, CategoryBreakdown> perCategory
) {
    public CatalogSummary {
        perCategory = perCategory != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(perCategory)) : Map.of();
    }

    /**
     * @param mappings        entries owned by the category
     * @param canonicalLabels distinct canonical labels owned by the category
     */
    public record CategoryBreakdown(int mappings, int canonicalLabels) {}
}
