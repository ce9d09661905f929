package com.catalog.reclassification.core.model;

/**
 * Stage that produced the decision on a record.
 */
public enum DecisionSource {
    NONE("none"),
    CATALOG("catalog"),
    CATALOG_CONTAINS("catalog-contains"),
    SEMANTIC_VALIDATOR("semantic-validator"),
    SEMANTIC("semantic"),
    RULE_ADDRESS("rule-address");

    private final String label;

    DecisionSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns true for the deterministic catalog stages.
     */
    public boolean isCatalog() {
        return this == CATALOG || this == CATALOG_CONTAINS;
    }
}
