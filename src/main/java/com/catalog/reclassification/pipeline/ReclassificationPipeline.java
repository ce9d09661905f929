package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.bulk.ProgressCallback;
import com.catalog.reclassification.catalog.Catalog;
import com.catalog.reclassification.catalog.CatalogIndex;
import com.catalog.reclassification.core.model.Record;
import com.catalog.reclassification.logging.LogContext;
import com.catalog.reclassification.metrics.MetricsService;
import com.catalog.reclassification.metrics.NoOpMetricsService;
import com.catalog.reclassification.rules.DefaultNormalizationRules;
import com.catalog.reclassification.rules.NormalizationEngine;
import com.catalog.reclassification.semantic.TfIdfIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the subcategory reclassification.
 *
 * <p>Each call to {@link #process} works on a private copy of the input and a catalog
 * snapshot, runs the layered stages in a fixed order and returns the three views with
 * their counts. The pipeline itself holds no per-run state, so one instance can serve
 * concurrent runs.</p>
 *
 * <pre>
 * ReclassificationPipeline pipeline = ReclassificationPipeline.builder()
 *     .metricsService(new MicrometerMetricsService(registry))
 *     .build();
 *
 * ReclassificationResult result = pipeline.process(records, catalog);
 * </pre>
 */
public class ReclassificationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ReclassificationPipeline.class);

    private final NormalizationEngine normalizationEngine;
    private final MetricsService metricsService;
    private final PipelineOptions defaultOptions;

    private ReclassificationPipeline(Builder builder) {
        this.normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.defaultOptions = builder.options != null ? builder.options : PipelineOptions.defaults();
    }

    public NormalizationEngine getNormalizationEngine() {
        return normalizationEngine;
    }

    public PipelineOptions getDefaultOptions() {
        return defaultOptions;
    }

    /**
     * Reclassifies the records with the pipeline's default options and no progress reporting.
     */
    public ReclassificationResult process(List<Record> input, Catalog catalog) {
        return process(input, catalog, defaultOptions, ProgressCallback.NOOP);
    }

    /**
     * Reclassifies the records against a catalog snapshot.
     *
     * @param input    the records to classify; they are copied and never modified
     * @param catalog  the catalog snapshot for this run
     * @param options  thresholds and rule settings
     * @param callback progress reporting, may be null
     * @throws StageExecutionException if a stage fails on a record
     */
    public ReclassificationResult process(List<Record> input, Catalog catalog,
                                          PipelineOptions options, ProgressCallback callback) {
        Objects.requireNonNull(input, "input is required");
        Objects.requireNonNull(catalog, "catalog is required");
        Objects.requireNonNull(options, "options is required");
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("pipeline.started records={} catalogEntries={} options={}",
                    input.size(), catalog.size(), options);
            report(cb, 0.0, "Starting");

            List<Record> records = new ArrayList<>(input.size());
            for (Record record : input) {
                records.add(record.pristineCopy());
            }

            CatalogIndex index = CatalogIndex.build(catalog, normalizationEngine);
            GuardRail guardRail = new GuardRail(index);
            if (index.isEmpty()) {
                log.warn("pipeline.empty_catalog every record will be kept or excluded by rule");
            }
            report(cb, 0.10, "Catalog indexed");

            runStage(new ExactCatalogMatcher(index, guardRail), records);
            report(cb, 0.15, "Exact catalog matches applied");

            runStage(new ContainsCatalogMatcher(index, guardRail, options.isContainsUsesAddress()), records);
            report(cb, 0.30, "Catalog substring matches applied");

            TfIdfIndex originalLabelIndex = TfIdfIndex.build(index.originalKeys());
            runStage(new SemanticValidator(index, originalLabelIndex, guardRail, options), records);
            report(cb, 0.45, "Catalog matches validated");

            TfIdfIndex canonicalLabelIndex = TfIdfIndex.build(index.canonicalKeys());
            runStage(new SemanticInferencer(index, canonicalLabelIndex, guardRail, options), records);
            report(cb, 0.70, "Semantic inference applied");

            runStage(new AddressExclusionRule(normalizationEngine, options.getAddressKeywords()), records);
            report(cb, 0.90, "Address rule applied");

            ReclassificationResult result = new Finalizer(options).complete(runId, records);
            record(result, Duration.ofNanos(System.nanoTime() - start));
            report(cb, 1.0, "Completed");

            log.info("pipeline.completed metrics={} durationMs={}",
                    result.metrics().toMap(), Duration.ofNanos(System.nanoTime() - start).toMillis());
            return result;
        } catch (StageExecutionException e) {
            log.error("pipeline.failed stage={} row={} error={}", e.getStage(), e.getRowIndex(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            throw e;
        }
    }

    private void runStage(RecordStage stage, List<Record> records) {
        long start = System.nanoTime();
        int changed = stage.apply(records);
        log.info("stage.completed stage={} changed={} durationMs={}",
                stage.getName(), changed, Duration.ofNanos(System.nanoTime() - start).toMillis());
    }

    private void record(ReclassificationResult result, Duration duration) {
        metricsService.recordRunDuration(duration);
        metricsService.recordBatchSize(result.full().size());
        for (Record record : result.full()) {
            metricsService.incrementDecision(record.getSource(), record.getAction());
            metricsService.recordConfidence(record.getConfidence());
        }
    }

    private static void report(ProgressCallback cb, double fraction, String message) {
        try {
            cb.onProgress(fraction, message);
        } catch (RuntimeException e) {
            log.warn("progress.callback_failed fraction={} error={}", fraction, e.getMessage());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NormalizationEngine normalizationEngine;
        private MetricsService metricsService;
        private PipelineOptions options;

        /**
         * Sets the normalization engine. Defaults to {@link DefaultNormalizationRules#createDefaultEngine()}.
         */
        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        /**
         * Sets the metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the options used by {@link ReclassificationPipeline#process(List, Catalog)}.
         */
        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public ReclassificationPipeline build() {
            return new ReclassificationPipeline(this);
        }
    }
}
