package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.Record;
import com.catalog.reclassification.core.model.RecordAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Last step of a run: records the pre-exclusion subcategory of excluded records,
 * collapses exact duplicates, builds the three views and counts.
 */
public class Finalizer {
    private static final Logger log = LoggerFactory.getLogger(Finalizer.class);

    private final PipelineOptions options;

    public Finalizer(PipelineOptions options) {
        this.options = options;
    }

    public ReclassificationResult complete(String runId, List<Record> records) {
        for (Record record : records) {
            if (record.isExcluded()) {
                String before = record.getPreExclusionSubcategory();
                record.setIntermediateSubcategory(before != null ? before : record.getOriginalSubcategory());
            }
        }

        List<Record> full = deduplicate(records);
        if (full.size() < records.size()) {
            log.info("finalizer.deduplicated removed={}", records.size() - full.size());
        }

        List<Record> lowConfidence = new ArrayList<>();
        List<Record> deliverable = new ArrayList<>();
        for (Record record : full) {
            if (record.getSource() == DecisionSource.SEMANTIC
                    && record.getConfidence() < options.getHiThreshold()) {
                lowConfidence.add(record);
            }
            if (options.getExclusionPolicy() == ExclusionPolicy.RETAIN_FLAGGED || !record.isExcluded()) {
                deliverable.add(record);
            }
        }

        return new ReclassificationResult(runId, full, lowConfidence, deliverable,
                count(full, lowConfidence.size()));
    }

    /**
     * Keeps the first occurrence of each distinct record, in input order.
     */
    static List<Record> deduplicate(List<Record> records) {
        Set<List<Object>> seen = new HashSet<>();
        List<Record> unique = new ArrayList<>(records.size());
        for (Record record : records) {
            if (seen.add(record.deduplicationKey())) {
                unique.add(record);
            }
        }
        return unique;
    }

    private static RunMetrics count(List<Record> full, long lowConfidence) {
        Map<String, Long> bySource = new LinkedHashMap<>();
        Map<String, Long> byAction = new LinkedHashMap<>();
        long excluded = 0;
        for (Record record : full) {
            if (record.getSource() != null) {
                bySource.merge(record.getSource().getLabel(), 1L, Long::sum);
            }
            if (record.getAction() != null) {
                byAction.merge(record.getAction().getLabel(), 1L, Long::sum);
            }
            if (record.isExcluded()) {
                excluded++;
            }
        }

        return new RunMetrics(
                full.size(),
                bySource.getOrDefault(DecisionSource.CATALOG.getLabel(), 0L),
                bySource.getOrDefault(DecisionSource.CATALOG_CONTAINS.getLabel(), 0L),
                bySource.getOrDefault(DecisionSource.SEMANTIC_VALIDATOR.getLabel(), 0L),
                bySource.getOrDefault(DecisionSource.SEMANTIC.getLabel(), 0L),
                byAction.getOrDefault(RecordAction.KEEP.getLabel(), 0L),
                excluded,
                byAction.getOrDefault(RecordAction.VERIFY.getLabel(), 0L),
                lowConfidence,
                bySource,
                byAction);
    }
}
