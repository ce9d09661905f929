package com.catalog.reclassification.bulk;

/**
 * Result of a CSV export.
 *
 * @param rowsWritten number of records written, header excluded
 */
public record ExportResult(long rowsWritten) {

    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten + '}';
    }
}
