package com.evidence.consensus.metrics;

import com.evidence.consensus.core.model.ConfidenceLevel;
import com.evidence.consensus.core.model.Severity;
import com.evidence.consensus.core.model.ValueKind;

import java.time.Duration;

/**
 * Interface for recording aggregation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void recordConsensus(ValueKind kind, ConfidenceLevel confidence);

    void incrementEntitiesMerged(int count);

    void recordIssue(Severity severity);

    void recordTargetDuration(Duration duration, boolean success);

    void recordBatchSize(int size);
}
