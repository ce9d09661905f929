package com.catalog.reclassification.metrics;

import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.RecordAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reclassification.run.duration}: Timer</li>
 *   <li>{@code reclassification.decision}: Counter (tags: source, action)</li>
 *   <li>{@code reclassification.confidence}: DistributionSummary</li>
 *   <li>{@code reclassification.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer runTimer;
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.runTimer = Timer.builder("reclassification.run.duration")
                .description("Duration of complete pipeline runs")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("reclassification.confidence")
                .description("Distribution of final record confidence")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("reclassification.batch.size")
                .description("Number of input records per run")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    @Override
    public void incrementDecision(DecisionSource source, RecordAction action) {
        String sourceTag = source != null ? source.getLabel() : "unset";
        String actionTag = action != null ? action.getLabel() : "unset";
        Counter counter = counterCache.computeIfAbsent(sourceTag + ":" + actionTag, k ->
                Counter.builder("reclassification.decision")
                        .description("Number of records decided per source and action")
                        .tag("source", sourceTag)
                        .tag("action", actionTag)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
