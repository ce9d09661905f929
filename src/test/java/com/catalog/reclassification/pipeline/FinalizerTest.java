package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.Record;
import com.catalog.reclassification.core.model.RecordAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FinalizerTest {

    private static Record record(String id, String subcategory) {
        return Record.builder().id(id).name("Name " + id).subcategory(subcategory).build();
    }

    @Test
    @DisplayName("Should keep the first of identical records in input order")
    void testDeduplication() {
        Record a = record("1", "Padaria");
        Record b = record("2", "Mercado");
        Record aDuplicate = record("1", "Padaria");
        for (Record r : List.of(a, b, aDuplicate)) {
            r.decide(RecordAction.KEEP, DecisionSource.NONE, 0.1);
        }

        List<Record> unique = Finalizer.deduplicate(List.of(a, b, aDuplicate));

        assertEquals(List.of(a, b), unique);
        assertSame(a, unique.get(0));
    }

    @Test
    @DisplayName("Records differing only in confidence should both survive")
    void testConfidenceIsPartOfTheKey() {
        Record a = record("1", "Padaria");
        Record b = record("1", "Padaria");
        a.decide(RecordAction.KEEP, DecisionSource.NONE, 0.1);
        b.decide(RecordAction.KEEP, DecisionSource.NONE, 0.2);

        assertEquals(2, Finalizer.deduplicate(List.of(a, b)).size());
    }

    @Test
    @DisplayName("Excluded records should carry their pre-exclusion subcategory")
    void testIntermediateSubcategory() {
        Record corrected = record("1", "Cabeleireiro");
        corrected.applyDecision("Salão de Beleza", RecordAction.CORRECT, DecisionSource.CATALOG, 0.99);
        corrected.applyDecision("Excluir", RecordAction.EXCLUDE, DecisionSource.RULE_ADDRESS, 1.0);
        Record excludedFromStart = record("2", "Excluir");
        excludedFromStart.decide(RecordAction.EXCLUDE, DecisionSource.NONE, 0.0);
        Record kept = record("3", "Padaria");
        kept.decide(RecordAction.KEEP, DecisionSource.NONE, 0.0);

        ReclassificationResult result = new Finalizer(PipelineOptions.defaults())
                .complete("run-1", List.of(corrected, excludedFromStart, kept));

        assertEquals("Salão de Beleza", corrected.getIntermediateSubcategory());
        assertEquals("Excluir", excludedFromStart.getIntermediateSubcategory());
        assertNull(kept.getIntermediateSubcategory());
        assertEquals("run-1", result.runId());
        assertEquals(2, result.metrics().excluded());
    }

    @Test
    @DisplayName("Low-confidence view should hold only semantic inferences below the high threshold")
    void testLowConfidenceView() {
        Record weak = record("1", "Padaria");
        weak.decide(RecordAction.INFER, DecisionSource.SEMANTIC, 0.75);
        Record strong = record("2", "Padaria");
        strong.decide(RecordAction.INFER, DecisionSource.SEMANTIC, 0.95);
        Record kept = record("3", "Padaria");
        kept.decide(RecordAction.KEEP, DecisionSource.NONE, 0.3);

        ReclassificationResult result = new Finalizer(PipelineOptions.defaults())
                .complete("run-2", List.of(weak, strong, kept));

        assertEquals(List.of(weak), result.lowConfidence());
        assertEquals(1, result.metrics().lowConfidence());
        assertEquals(3, result.deliverable().size());
    }

    @Test
    @DisplayName("RunMetrics should expose the reporting mapping in a fixed order")
    void testMetricsMap() {
        Record kept = record("1", "Padaria");
        kept.decide(RecordAction.KEEP, DecisionSource.NONE, 0.3);

        RunMetrics metrics = new Finalizer(PipelineOptions.defaults()).complete("run-3", List.of(kept)).metrics();

        assertEquals(List.of("total", "catalogExact", "catalogContains", "semanticInferred", "kept",
                        "excluded", "lowConfidence", "semanticValidator", "verify"),
                List.copyOf(metrics.toMap().keySet()));
        assertEquals(1L, metrics.toMap().get("total"));
        assertEquals(1L, metrics.toMap().get("kept"));
    }
}
