package com.catalog.reclassification.bulk;

import com.catalog.reclassification.core.model.Record;

import java.util.List;

/**
 * Result of reading an input table.
 *
 * @param records      the records built, in table order
 * @param extraColumns headers carried on each record as attributes, in table order
 */
public record ReadResult(List<Record> records, List<String> extraColumns) {

    public ReadResult {
        records = records != null ? List.copyOf(records) : List.of();
        extraColumns = extraColumns != null ? List.copyOf(extraColumns) : List.of();
    }

    @Override
    public String toString() {
        return "ReadResult{records=" + records.size() + ", extraColumns=" + extraColumns + '}';
    }
}
