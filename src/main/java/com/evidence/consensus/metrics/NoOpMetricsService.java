package com.evidence.consensus.metrics;

import com.evidence.consensus.core.model.ConfidenceLevel;
import com.evidence.consensus.core.model.Severity;
import com.evidence.consensus.core.model.ValueKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. All methods are empty.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordConsensus(ValueKind kind, ConfidenceLevel confidence) {
    }

    @Override
    public void incrementEntitiesMerged(int count) {
    }

    @Override
    public void recordIssue(Severity severity) {
    }

    @Override
    public void recordTargetDuration(Duration duration, boolean success) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
