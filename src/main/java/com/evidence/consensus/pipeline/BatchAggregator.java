package com.evidence.consensus.pipeline;

import com.evidence.consensus.config.EngineConfig;
import com.evidence.consensus.logging.LogContext;
import com.evidence.consensus.metrics.MetricsService;
import com.evidence.consensus.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent targets on a fixed-size worker pool, one target per worker slot.
 *
 * <p>A target's aggregate is published (future completed, listener notified) only after it
 * is fully built. Cancelling a target's future abandons the task; a task that finishes after
 * cancellation publishes nothing.</p>
 */
public class BatchAggregator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchAggregator.class);

    private final AggregationEngine engine;
    private final MetricsService metrics;
    private final AggregationListener listener;
    private final boolean skipEmpty;
    private final int concurrency;
    private final ExecutorService executor;

    /**
     * Sizes the worker pool from {@link EngineConfig#getConcurrency()}.
     */
    public static BatchAggregator create(AggregationEngine engine, EngineConfig config) {
        return create(engine, config, new NoOpMetricsService(), AggregationListener.NOOP);
    }

    public static BatchAggregator create(AggregationEngine engine, EngineConfig config,
                                         MetricsService metrics, AggregationListener listener) {
        return new BatchAggregator(engine, config.getConcurrency(), metrics, listener, true);
    }

    public BatchAggregator(AggregationEngine engine, int concurrency) {
        this(engine, concurrency, new NoOpMetricsService(), AggregationListener.NOOP, true);
    }

    public BatchAggregator(AggregationEngine engine, int concurrency, MetricsService metrics,
                           AggregationListener listener, boolean skipEmpty) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.listener = listener != null ? listener : AggregationListener.NOOP;
        this.skipEmpty = skipEmpty;
        this.concurrency = concurrency;
        this.executor = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory());
    }

    /**
     * Schedules one target. The returned future may be cancelled to abandon it.
     */
    public CompletableFuture<TargetAggregate> submit(AggregationTarget target) {
        CompletableFuture<TargetAggregate> future = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> run(target, future));
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                task.cancel(true);
            }
        });
        return future;
    }

    /**
     * Aggregates every target and waits for all of them.
     */
    public BatchResult aggregateAll(List<AggregationTarget> targets) {
        String batchId = LogContext.generateCorrelationId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("batch.starting batchId={} targets={} concurrency={}", batchId, targets.size(), concurrency);
            metrics.recordBatchSize(targets.size());

            Map<String, CompletableFuture<TargetAggregate>> futures = new LinkedHashMap<>();
            List<String> skipped = new ArrayList<>();
            for (AggregationTarget target : targets) {
                if (skipEmpty && target.isEmpty()) {
                    log.debug("batch.skipped targetId={} reason=empty", target.targetId());
                    skipped.add(target.targetId());
                    continue;
                }
                if (futures.containsKey(target.targetId())) {
                    log.warn("batch.duplicate targetId={}; keeping the first", target.targetId());
                    continue;
                }
                futures.put(target.targetId(), submit(target));
            }

            Map<String, TargetAggregate> successful = new LinkedHashMap<>();
            Map<String, String> failed = new LinkedHashMap<>();
            futures.forEach((targetId, future) -> {
                try {
                    successful.put(targetId, future.join());
                } catch (CancellationException e) {
                    failed.put(targetId, "cancelled");
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    failed.put(targetId, cause.getClass().getSimpleName() + ": " + cause.getMessage());
                }
            });

            BatchResult result = new BatchResult(successful, failed, skipped,
                    Duration.ofNanos(System.nanoTime() - start));
            log.info("batch.completed batchId={} result={}", batchId, result);
            return result;
        }
    }

    private void run(AggregationTarget target, CompletableFuture<TargetAggregate> future) {
        if (future.isDone()) {
            return;
        }
        try (LogContext ctx = LogContext.forTarget(LogContext.generateCorrelationId(), target.targetId())) {
            long start = System.nanoTime();
            TargetAggregate aggregate;
            try {
                notifyListener(() -> listener.onTargetStarted(target.targetId()));
                aggregate = engine.aggregate(target);
            } catch (Throwable e) {
                // Errors too: the future must complete or aggregateAll never returns
                metrics.recordTargetDuration(Duration.ofNanos(System.nanoTime() - start), false);
                log.error("aggregation.failed targetId={} error={}", target.targetId(), e.toString(), e);
                if (future.completeExceptionally(e)) {
                    notifyListener(() -> listener.onTargetFailed(target.targetId(), e));
                }
                return;
            }
            metrics.recordTargetDuration(Duration.ofNanos(System.nanoTime() - start), true);
            if (future.complete(aggregate)) {
                notifyListener(() -> listener.onTargetCompleted(aggregate));
            } else {
                log.info("aggregation.discarded targetId={} reason=cancelled", target.targetId());
            }
        }
    }

    private void notifyListener(Runnable event) {
        try {
            event.run();
        } catch (RuntimeException e) {
            log.warn("Aggregation listener failed: {}", e.getMessage(), e);
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "evidence-aggregator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
