package com.catalog.reclassification.catalog;

import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup structures derived from a {@link Catalog} snapshot.
 *
 * <p>All maps keep the catalog's iteration order of first appearance; when two entries share
 * a key the later entry's value wins. Keys are normalized labels.</p>
 */
public final class CatalogIndex {
    private static final Logger log = LoggerFactory.getLogger(CatalogIndex.class);

    private final NormalizationEngine engine;
    private final Map<String, String> originalToCanonical;
    private final Map<String, String> originalToCanonicalKey;
    private final Map<String, String> canonicalToCategory;
    private final Map<String, String> canonicalToLabel;

    private CatalogIndex(Catalog catalog, NormalizationEngine engine) {
        this.engine = engine;
        Map<String, String> toCanonical = new LinkedHashMap<>();
        Map<String, String> toCanonicalKey = new LinkedHashMap<>();
        Map<String, String> toCategory = new LinkedHashMap<>();
        Map<String, String> toLabel = new LinkedHashMap<>();

        for (CatalogEntry entry : catalog.entries()) {
            if (!entry.kOriginal().isEmpty()) {
                toCanonical.put(entry.kOriginal(), entry.canonicalLabel());
                toCanonicalKey.put(entry.kOriginal(), entry.kCanonical());
            }
            if (!entry.kCanonical().isEmpty()) {
                toCategory.put(entry.kCanonical(), entry.owningCategory());
                toLabel.put(entry.kCanonical(), entry.canonicalLabel());
            }
        }

        this.originalToCanonical = Collections.unmodifiableMap(toCanonical);
        this.originalToCanonicalKey = Collections.unmodifiableMap(toCanonicalKey);
        this.canonicalToCategory = Collections.unmodifiableMap(toCategory);
        this.canonicalToLabel = Collections.unmodifiableMap(toLabel);
    }

    /**
     * Builds the index over a catalog snapshot.
     */
    public static CatalogIndex build(Catalog catalog, NormalizationEngine engine) {
        CatalogIndex index = new CatalogIndex(catalog, engine);
        log.debug("catalog.indexed entries={} originalKeys={} canonicalKeys={}",
                catalog.size(), index.originalToCanonical.size(), index.canonicalToCategory.size());
        return index;
    }

    public NormalizationEngine getNormalizationEngine() {
        return engine;
    }

    /**
     * Canonical label (pretty form) for a normalized original label.
     */
    public Optional<String> canonicalForOriginal(String kOriginal) {
        return Optional.ofNullable(originalToCanonical.get(kOriginal));
    }

    /**
     * Normalized canonical label for a normalized original label.
     */
    public Optional<String> canonicalKeyForOriginal(String kOriginal) {
        return Optional.ofNullable(originalToCanonicalKey.get(kOriginal));
    }

    /**
     * Owning category for a normalized canonical label.
     */
    public Optional<String> owningCategory(String kCanonical) {
        return Optional.ofNullable(canonicalToCategory.get(kCanonical));
    }

    /**
     * Pretty canonical label for a normalized canonical label.
     */
    public Optional<String> canonicalLabel(String kCanonical) {
        return Optional.ofNullable(canonicalToLabel.get(kCanonical));
    }

    /**
     * Owning category of a canonical label given in any spelling, used to pre-fill curation forms.
     */
    public Optional<String> owningCategoryOf(String canonicalLabel) {
        return owningCategory(engine.normalize(canonicalLabel));
    }

    /**
     * Normalized original labels in catalog order.
     */
    public List<String> originalKeys() {
        return List.copyOf(originalToCanonical.keySet());
    }

    /**
     * Normalized canonical labels in catalog order.
     */
    public List<String> canonicalKeys() {
        return List.copyOf(canonicalToLabel.keySet());
    }

    /**
     * Distinct pretty canonical labels in catalog order.
     */
    public List<String> canonicalLabels() {
        Set<String> labels = new LinkedHashSet<>(canonicalToLabel.values());
        return new ArrayList<>(labels);
    }

    /**
     * Distinct owning categories in catalog order.
     */
    public List<String> categories() {
        return new ArrayList<>(new LinkedHashSet<>(canonicalToCategory.values()));
    }

    public boolean isEmpty() {
        return originalToCanonical.isEmpty() && canonicalToCategory.isEmpty();
    }
}
