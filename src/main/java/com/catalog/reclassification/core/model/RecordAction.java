package com.catalog.reclassification.core.model;

/**
 * Action decided for a record by the reclassification pipeline.
 * A record whose action is still {@code null} has not been decided by any stage.
 */
public enum RecordAction {
    /**
     * No confident classification was found; the record keeps its subcategory.
     */
    KEEP("Keep"),

    /**
     * Subcategory was corrected from the catalog or by the semantic validator.
     */
    CORRECT("Correct"),

    /**
     * Subcategory was inferred by semantic similarity.
     */
    INFER("Infer"),

    /**
     * Record resolves to the exclusion sentinel.
     */
    EXCLUDE("Exclude"),

    /**
     * Deterministic result looks suspicious and needs human review.
     */
    VERIFY("Verify");

    private final String label;

    RecordAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
