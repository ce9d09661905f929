package com.catalog.reclassification.metrics;

import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.RecordAction;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Duration duration) {
    }

    @Override
    public void incrementDecision(DecisionSource source, RecordAction action) {
    }

    @Override
    public void recordConfidence(double confidence) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
