package com.catalog.reclassification.catalog;

/**
 * Logical columns of a catalog table.
 */
public enum CatalogField {
    ORIGINAL_LABEL,
    CANONICAL_LABEL,
    OWNING_CATEGORY
}
