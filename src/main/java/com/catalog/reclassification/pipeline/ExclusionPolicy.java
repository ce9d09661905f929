package com.catalog.reclassification.pipeline;

/**
 * What the deliverable view does with records resolved to the exclusion sentinel.
 */
public enum ExclusionPolicy {
    /**
     * Excluded records stay in the deliverable, flagged with the Exclude action.
     */
    RETAIN_FLAGGED,

    /**
     * Excluded records are left out of the deliverable (they still count in the metrics).
     */
    DROP
}
