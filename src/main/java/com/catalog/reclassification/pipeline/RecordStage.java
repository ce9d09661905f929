package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.core.model.Record;

import java.util.List;

/**
 * One pass of the pipeline over the whole batch.
 * Subclasses choose which records they look at and how they decide them; any failure on
 * a record aborts the pass with a {@link StageExecutionException}.
 */
public abstract class RecordStage {

    /**
     * Name used in logs and errors.
     */
    public abstract String getName();

    /**
     * Returns true if this stage should look at the record.
     */
    protected abstract boolean accepts(Record record);

    /**
     * Decides one record.
     *
     * @return true if the record was changed
     */
    protected abstract boolean process(Record record);

    /**
     * Runs the stage over the batch.
     *
     * @return number of records changed
     */
    public int apply(List<Record> records) {
        int changed = 0;
        for (int i = 0; i < records.size(); i++) {
            Record record = records.get(i);
            if (!accepts(record)) {
                continue;
            }
            try {
                if (process(record)) {
                    changed++;
                }
            } catch (RuntimeException e) {
                throw new StageExecutionException(getName(), i, e);
            }
        }
        return changed;
    }

    /**
     * Rounds a similarity to four decimals within [0, 1].
     */
    protected static double roundConfidence(double similarity) {
        double clamped = Math.min(1.0, Math.max(0.0, similarity));
        return Math.round(clamped * 10_000.0) / 10_000.0;
    }
}
