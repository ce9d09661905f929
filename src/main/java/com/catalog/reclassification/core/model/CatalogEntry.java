package com.catalog.reclassification.core.model;

import com.catalog.reclassification.rules.NormalizationEngine;

import java.util.Locale;
import java.util.Objects;

/**
 * One curated mapping of the catalog: a raw subcategory label, the canonical label it
 * should become, and the category that owns the canonical label.
 *
 * <p>The catalog guarantees that a canonical label always belongs to exactly one owning
 * category. The canonical label {@value #EXCLUSION_SENTINEL} means "exclude this record".</p>
 *
 * @param originalLabel  raw label as found in input data
 * @param canonicalLabel standardized subcategory
 * @param owningCategory authoritative category of the canonical label
 * @param kOriginal      normalized original label
 * @param kCanonical     normalized canonical label
 * @param kCategory      normalized owning category
 */
public record CatalogEntry(
        String originalLabel,
        String canonicalLabel,
        String owningCategory,
        String kOriginal,
        String kCanonical,
        String kCategory
) {
    public static final String EXCLUSION_SENTINEL = "Excluir";

    private static final String EXCLUSION_KEY = "excluir";

    public CatalogEntry {
        Objects.requireNonNull(originalLabel, "originalLabel is required");
        Objects.requireNonNull(canonicalLabel, "canonicalLabel is required");
        Objects.requireNonNull(owningCategory, "owningCategory is required");
        Objects.requireNonNull(kOriginal, "kOriginal is required");
        Objects.requireNonNull(kCanonical, "kCanonical is required");
        Objects.requireNonNull(kCategory, "kCategory is required");
    }

    /**
     * Creates an entry, computing the normalized keys with the given engine.
     */
    public static CatalogEntry of(String originalLabel, String canonicalLabel, String owningCategory,
                                  NormalizationEngine engine) {
        return new CatalogEntry(
                originalLabel.strip(),
                canonicalLabel.strip(),
                owningCategory.strip(),
                engine.normalize(originalLabel),
                engine.normalize(canonicalLabel),
                engine.normalize(owningCategory));
    }

    /**
     * Returns true if this entry maps to the exclusion sentinel.
     */
    public boolean isExclusion() {
        return EXCLUSION_KEY.equals(kCanonical);
    }

    /**
     * Returns true if the given label is the exclusion sentinel (case and padding insensitive).
     */
    public static boolean isExclusionLabel(String label) {
        return label != null && EXCLUSION_KEY.equals(label.strip().toLowerCase(Locale.ROOT));
    }
}
