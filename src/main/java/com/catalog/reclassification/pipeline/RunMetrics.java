package com.catalog.reclassification.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts of one run, computed over the deduplicated full view.
 *
 * @param total             records after deduplication, excluded ones included
 * @param catalogExact      records decided by the exact catalog stage
 * @param catalogContains   records decided by the substring catalog stage
 * @param semanticValidator records corrected by the semantic validator
 * @param semanticInferred  records decided by semantic inference
 * @param kept              records left unchanged for lack of a match
 * @param excluded          records resolved to the exclusion sentinel
 * @param verify            records flagged for human review
 * @param lowConfidence     semantic inferences below the high threshold
 * @param bySource          counts per decision source label
 * @param byAction          counts per action label
 */
public record RunMetrics(
        long total,
        long catalogExact,
        long catalogContains,
        long semanticValidator,
        long semanticInferred,
        long kept,
        long excluded,
        long verify,
        long lowConfidence,
        Map<String, Long> bySource,
        Map<String, Long> byAction
) {
    public RunMetrics {
        bySource = bySource != null ? Collections.unmodifiableMap(new LinkedHashMap<>(bySource)) : Map.of();
        byAction = byAction != null ? Collections.unmodifiableMap(new LinkedHashMap<>(byAction)) : Map.of();
    }

    /**
     * The reporting mapping: {total, catalogExact, catalogContains, semanticInferred, kept,
     * excluded, lowConfidence}, followed by semanticValidator and verify.
     */
    public Map<String, Long> toMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        map.put("total", total);
        map.put("catalogExact", catalogExact);
        map.put("catalogContains", catalogContains);
        map.put("semanticInferred", semanticInferred);
        map.put("kept", kept);
        map.put("excluded", excluded);
        map.put("lowConfidence", lowConfidence);
        map.put("semanticValidator", semanticValidator);
        map.put("verify", verify);
        return map;
    }
}
