package com.evidence.consensus.pipeline;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch aggregation.
 *
 * @param successful aggregates by target id, in submission order
 * @param failed     error message by target id for targets whose task threw or was cancelled
 * @param skipped    target ids skipped for having neither estimates nor candidates
 * @param elapsed    wall-clock time of the batch
 */
public record BatchResult(
        Map<String, TargetAggregate> successful,
        Map<String, String> failed,
        List<String> skipped,
        Duration elapsed
) {
    public BatchResult {
        successful = Collections.unmodifiableMap(new LinkedHashMap<>(successful));
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        skipped = List.copyOf(skipped);
    }

    public int total() {
        return successful.size() + failed.size() + skipped.size();
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "successful=" + successful.size() +
                ", failed=" + failed.size() +
                ", skipped=" + skipped.size() +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                '}';
    }
}
