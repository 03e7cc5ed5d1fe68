/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.logging.ThrottledLog;
import com.intuitivedesigns.chainkernel.metrics.KernelMetrics;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Writes dedup marks after the bus acknowledges an event, on a small pool of its own.
 *
 * <p>The acknowledging thread (the publisher's delivery thread) only enqueues. A slow or hung cache
 * backs up this pool and nothing else; when its queue is full the mark is dropped and counted,
 * which at worst lets a replay publish a duplicate.</p>
 */
public final class DedupMarker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DedupMarker.class);

    public static final String KEY_THREADS = "dedup.mark.threads";
    public static final String KEY_QUEUE_CAPACITY = "dedup.mark.queue.capacity";

    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;
    private static final long CLOSE_WAIT_MS = 2_000L;

    private final DedupCache cache;
    private final MetricsRuntime metrics;
    private final ThreadPoolExecutor executor;

    private final LongAdder applied = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final ThrottledLog errorLog = ThrottledLog.warn(log, ERROR_LOG_INTERVAL_MS);

    public DedupMarker(DedupCache cache, int threads, int queueCapacity, MetricsRuntime metrics) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.metrics = metrics == null ? MetricsRuntime.noop() : metrics;
        final int poolSize = Math.max(1, threads);
        final AtomicInteger seq = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                r -> {
                    Thread t = new Thread(r, "ck-dedup-mark-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    public static DedupMarker from(KernelConfig config, DedupCache cache, MetricsRuntime metrics) {
        return new DedupMarker(cache,
                config.getInt(KEY_THREADS, 2),
                config.getInt(KEY_QUEUE_CAPACITY, 10_000),
                metrics);
    }

    /**
     * Schedules {@code mark(dedupKey, ttl)} once {@code delivery} completes normally. Returns at once.
     */
    public void markWhenDelivered(CompletableFuture<?> delivery, String dedupKey, Duration ttl) {
        delivery.whenComplete((receipt, failure) -> {
            if (failure == null) {
                submit(dedupKey, ttl);
            }
        });
    }

    private void submit(String dedupKey, Duration ttl) {
        try {
            executor.execute(() -> apply(dedupKey, ttl));
        } catch (RejectedExecutionException e) {
            dropped.increment();
            metrics.counter(KernelMetrics.DEDUP_MARKS_DROPPED);
            errorLog.report("Dedup mark dropped for " + dedupKey, e);
        }
    }

    private void apply(String dedupKey, Duration ttl) {
        try {
            cache.mark(dedupKey, ttl);
            applied.increment();
        } catch (RuntimeException e) {
            metrics.counter(KernelMetrics.CACHE_ERRORS);
            errorLog.report("Dedup mark failed for " + dedupKey, e);
        }
    }

    public long appliedCount() {
        return applied.sum();
    }

    public long droppedCount() {
        return dropped.sum();
    }

    public int queued() {
        return executor.getQueue().size();
    }

    /**
     * Lets queued marks finish for a short while, then abandons the rest.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Abandoning {} queued dedup mark(s) on close", executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
