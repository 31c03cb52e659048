package com.evidence.consensus.metrics;

import com.evidence.consensus.core.model.ConfidenceLevel;
import com.evidence.consensus.core.model.Severity;
import com.evidence.consensus.core.model.ValueKind;
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
 *   <li>{@code evidence.consensus.computed} (Counter, tags: valueKind, confidence)</li>
 *   <li>{@code evidence.entities.merged} (Counter)</li>
 *   <li>{@code evidence.validation.issues} (Counter, tag: severity)</li>
 *   <li>{@code evidence.target.duration} (Timer, tag: outcome)</li>
 *   <li>{@code evidence.batch.size} (DistributionSummary)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter entitiesMergedCounter;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.entitiesMergedCounter = Counter.builder("evidence.entities.merged")
                .description("Number of merged entities produced")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("evidence.batch.size")
                .description("Distribution of targets per aggregation batch")
                .register(registry);
    }

    @Override
    public void recordConsensus(ValueKind kind, ConfidenceLevel confidence) {
        String key = "consensus:" + kind.name() + ":" + confidence.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("evidence.consensus.computed")
                        .description("Number of consensus results by confidence")
                        .tag("valueKind", kind.getLabel())
                        .tag("confidence", confidence.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementEntitiesMerged(int count) {
        entitiesMergedCounter.increment(count);
    }

    @Override
    public void recordIssue(Severity severity) {
        String key = "issue:" + severity.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("evidence.validation.issues")
                        .description("Number of validation issues raised")
                        .tag("severity", severity.getLabel())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordTargetDuration(Duration duration, boolean success) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("evidence.target.duration")
                        .description("Duration of one target's aggregation")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
