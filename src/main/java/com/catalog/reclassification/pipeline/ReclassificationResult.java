package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.Record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one pipeline run.
 *
 * @param runId         identifier of the run, also found in the log MDC
 * @param full          every deduplicated record with its annotations
 * @param lowConfidence semantic inferences below the high threshold
 * @param deliverable   the records to hand over, shaped by the exclusion policy
 * @param metrics       aggregate counts
 */
public record ReclassificationResult(
        String runId,
        List<Record> full,
        List<Record> lowConfidence,
        List<Record> deliverable,
        RunMetrics metrics
) {
    public ReclassificationResult {
        full = List.copyOf(full);
        lowConfidence = List.copyOf(lowConfidence);
        deliverable = List.copyOf(deliverable);
    }

    /**
     * Groups the full view by decision source, sources in order of first appearance.
     */
    public Map<DecisionSource, List<Record>> bySource() {
        Map<DecisionSource, List<Record>> groups = new LinkedHashMap<>();
        for (Record record : full) {
            if (record.getSource() != null) {
                groups.computeIfAbsent(record.getSource(), s -> new ArrayList<>()).add(record);
            }
        }
        groups.replaceAll((source, records) -> Collections.unmodifiableList(records));
        return Collections.unmodifiableMap(groups);
    }
}
