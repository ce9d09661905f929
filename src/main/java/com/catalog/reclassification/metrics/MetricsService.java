package com.catalog.reclassification.metrics;

import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.RecordAction;

import java.time.Duration;

/**
 * Interface for recording reclassification metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline works
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordRunDuration(Duration duration);

    void incrementDecision(DecisionSource source, RecordAction action);

    void recordConfidence(double confidence);

    void recordBatchSize(int size);
}
