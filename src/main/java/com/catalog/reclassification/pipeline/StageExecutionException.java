package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.core.ReclassificationException;

/**
 * Runtime exception thrown when a stage fails on a record. The whole run is aborted:
 * a partially annotated batch would break the category invariants.
 */
public class StageExecutionException extends ReclassificationException {

    private final String stage;
    private final int rowIndex;

    public StageExecutionException(String stage, int rowIndex, Throwable cause) {
        super("Stage '" + stage + "' failed on row " + rowIndex + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.rowIndex = rowIndex;
    }

    public String getStage() {
        return stage;
    }

    /**
     * Zero-based position of the failing record in the batch.
     */
    public int getRowIndex() {
        return rowIndex;
    }
}
