package com.catalog.reclassification.catalog;

import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.rules.NormalizationEngine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of the curated catalog handed to one pipeline run.
 *
 * <p>Entries are deduplicated on their normalized (original, canonical, category) keys.
 * On conflict the later entry wins and takes the later position, so mappings curated
 * during a session override older ones. Session additions are applied with
 * {@link #extend(List)}, which returns a new snapshot.</p>
 */
public final class Catalog {

    private static final Catalog EMPTY = new Catalog(List.of());

    private final List<CatalogEntry> entries;

    private Catalog(List<CatalogEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * Creates a catalog from entries, deduplicating with last-write-wins semantics.
     */
    public static Catalog of(List<CatalogEntry> entries) {
        Objects.requireNonNull(entries, "entries is required");
        Map<List<String>, CatalogEntry> byKey = new LinkedHashMap<>();
        for (CatalogEntry entry : entries) {
            List<String> key = List.of(entry.kOriginal(), entry.kCanonical(), entry.kCategory());
            byKey.remove(key);
            byKey.put(key, entry);
        }
        return new Catalog(new ArrayList<>(byKey.values()));
    }

    public static Catalog empty() {
        return EMPTY;
    }

    /**
     * Builds a catalog from raw table rows, resolving the column headers through the aliases.
     *
     * @throws CatalogFormatException if a required column is missing or a required cell is blank
     */
    public static Catalog fromRows(List<String> headers, List<Map<String, String>> rows,
                                   HeaderAliases<CatalogField> aliases, NormalizationEngine engine) {
        return fromRows(headers, rows, aliases, engine, null);
    }

    /**
     * Builds a catalog from the rows of a single-category table. The owning category of every
     * entry is {@code category}; the table needs no category column.
     */
    public static Catalog fromCategoryRows(String category, List<String> headers, List<Map<String, String>> rows,
                                           HeaderAliases<CatalogField> aliases, NormalizationEngine engine) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must not be blank");
        }
        return fromRows(headers, rows, aliases, engine, category);
    }

    private static Catalog fromRows(List<String> headers, List<Map<String, String>> rows,
                                    HeaderAliases<CatalogField> aliases, NormalizationEngine engine,
                                    String fixedCategory) {
        Map<CatalogField, String> columns = aliases.resolve(headers);
        List<CatalogField> missing = new ArrayList<>(aliases.missingRequired(columns));
        if (fixedCategory != null) {
            missing.remove(CatalogField.OWNING_CATEGORY);
        }
        if (!missing.isEmpty()) {
            throw new CatalogFormatException("Catalog is missing required columns " + missing
                    + " (headers: " + headers + ")");
        }

        List<CatalogEntry> entries = new ArrayList<>(rows.size());
        int rowNumber = 1;
        for (Map<String, String> row : rows) {
            rowNumber++;
            String original = cell(row, columns.get(CatalogField.ORIGINAL_LABEL));
            String canonical = cell(row, columns.get(CatalogField.CANONICAL_LABEL));
            String category = fixedCategory != null
                    ? fixedCategory : cell(row, columns.get(CatalogField.OWNING_CATEGORY));

            if (original.isBlank() && canonical.isBlank() && (fixedCategory != null || category.isBlank())) {
                continue;
            }
            if (original.isBlank() || canonical.isBlank() || category.isBlank()) {
                throw new CatalogFormatException("Catalog row " + rowNumber
                        + " has a blank original label, canonical label or owning category");
            }
            entries.add(CatalogEntry.of(original, canonical, category, engine));
        }
        return of(entries);
    }

    /**
     * Returns a new snapshot with the given entries appended.
     */
    public Catalog extend(List<CatalogEntry> additions) {
        if (additions == null || additions.isEmpty()) {
            return this;
        }
        List<CatalogEntry> combined = new ArrayList<>(entries);
        combined.addAll(additions);
        return of(combined);
    }

    public List<CatalogEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Counts categories, labels and mappings, overall and per owning category.
     */
    public CatalogSummary summarize() {
        Set<String> categories = new LinkedHashSet<>();
        Set<String> originals = new LinkedHashSet<>();
        Set<String> canonicals = new LinkedHashSet<>();
        Map<String, Integer> mappingsPerCategory = new TreeMap<>();
        Map<String, Set<String>> canonicalsPerCategory = new TreeMap<>();

        for (CatalogEntry entry : entries) {
            categories.add(entry.owningCategory());
            originals.add(entry.originalLabel());
            canonicals.add(entry.canonicalLabel());
            mappingsPerCategory.merge(entry.owningCategory(), 1, Integer::sum);
            canonicalsPerCategory.computeIfAbsent(entry.owningCategory(), c -> new LinkedHashSet<>())
                    .add(entry.canonicalLabel());
        }

        Map<String, CatalogSummary.CategoryBreakdown> perCategory = new LinkedHashMap<>();
        mappingsPerCategory.forEach((category, mappings) -> perCategory.put(category,
                new CatalogSummary.CategoryBreakdown(mappings, canonicalsPerCategory.get(category).size())));

        return new CatalogSummary(categories.size(), originals.size(), canonicals.size(),
                entries.size(), perCategory);
    }

    private static String cell(Map<String, String> row, String column) {
        if (column == null) {
            return "";
        }
        String value = row.get(column);
        return value != null ? value.strip() : "";
    }

    @Override
    public String toString() {
        return "Catalog{entries=" + entries.size() + '}';
    }
}
