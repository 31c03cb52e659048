package com.evidence.consensus.pipeline;

/**
 * Callback for following a batch aggregation. Invoked from worker threads.
 * A listener that throws is logged and otherwise ignored.
 */
public interface AggregationListener {

    default void onTargetStarted(String targetId) {
    }

    /**
     * Called once per target with its complete aggregate.
     */
    default void onTargetCompleted(TargetAggregate aggregate) {
    }

    default void onTargetFailed(String targetId, Throwable error) {
    }

    /**
     * A listener that ignores every event.
     */
    AggregationListener NOOP = new AggregationListener() {
    };
}
