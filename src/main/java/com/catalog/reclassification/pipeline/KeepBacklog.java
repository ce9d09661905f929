package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.core.model.Record;
import com.catalog.reclassification.core.model.RecordAction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Curation backlog: the original subcategories that ended up with the Keep action,
 * most frequent first, so curators map the labels with the largest impact first.
 */
public final class KeepBacklog {

    private KeepBacklog() {
        // Utility class
    }

    /**
     * @param originalSubcategory the raw subcategory as received
     * @param records             number of kept records carrying it
     * @param meanConfidence      mean of their best similarity, three decimals
     * @param maxConfidence       highest of their best similarity, three decimals
     */
    public record Entry(String originalSubcategory, long records, double meanConfidence, double maxConfidence) {}

    public static List<Entry> summarize(List<Record> records) {
        Map<String, List<Double>> confidences = new LinkedHashMap<>();
        for (Record record : records) {
            if (record.getAction() == RecordAction.KEEP) {
                confidences.computeIfAbsent(record.getOriginalSubcategory(), k -> new ArrayList<>())
                        .add(record.getConfidence());
            }
        }

        List<Entry> entries = new ArrayList<>();
        confidences.forEach((subcategory, values) -> {
            double sum = 0.0;
            double max = 0.0;
            for (double value : values) {
                sum += value;
                max = Math.max(max, value);
            }
            entries.add(new Entry(subcategory, values.size(), round3(sum / values.size()), round3(max)));
        });
        entries.sort(Comparator.comparingLong(Entry::records).reversed());
        return entries;
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
