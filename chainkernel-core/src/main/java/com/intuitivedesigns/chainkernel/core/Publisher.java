/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.PublishException;
import com.intuitivedesigns.chainkernel.logging.ThrottledLog;
import com.intuitivedesigns.chainkernel.metrics.KernelMetrics;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.model.DeliveryReceipt;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * At-least-once hand-off of normalized events to the {@link EventBus}.
 *
 * Features:
 * - Bounded local buffer; {@link #publish} blocks when it is full (backpressure onto workers)
 * - Single delivery thread, so per-source order is the order of {@code publish} calls
 * - Redelivery with backoff from the first unacknowledged event of a batch
 * - Sources whose events wait past the staleness bound are reported degraded, then recovered
 * - Rate-limited error logging
 */
public final class Publisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Publisher.class);

    private static final long POLL_MS = 100L;
    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;

    private final EventBus bus;
    private final PublisherSettings settings;
    private final MetricsRuntime metrics;
    private final LinkedBlockingQueue<Pending> queue;
    private final Thread deliveryThread;

    private volatile DeliveryHealthListener healthListener = (sourceId, degraded) -> {};

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean closing;
    private volatile long closeDeadlineNanos;

    // Touched only by the delivery thread
    private final Set<String> degradedSources = new HashSet<>();

    private final LongAdder published = new LongAdder();
    private final LongAdder retries = new LongAdder();

    private final ThrottledLog errorLog = ThrottledLog.error(log, ERROR_LOG_INTERVAL_MS);

    public Publisher(EventBus bus, PublisherSettings settings, MetricsRuntime metrics) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.queue = new LinkedBlockingQueue<>(settings.bufferCapacity());
        this.deliveryThread = new Thread(this::deliveryLoop, "ck-publisher");
        this.deliveryThread.setDaemon(true);
    }

    public void setHealthListener(DeliveryHealthListener listener) {
        this.healthListener = Objects.requireNonNull(listener, "listener");
    }

    public void start() {
        if (started.compareAndSet(false, true)) {
            deliveryThread.start();
            log.info("Publisher started. buffer={} batch={} staleness={}",
                    settings.bufferCapacity(), settings.batchSize(), settings.staleness());
        }
    }

    /**
     * Queues one event for delivery, blocking while the buffer is full.
     *
     * @return completes with the bus receipt once the event is acknowledged
     */
    public CompletableFuture<DeliveryReceipt> publish(NormalizedEvent event) throws InterruptedException {
        Objects.requireNonNull(event, "event");
        if (closing) {
            return CompletableFuture.failedFuture(new PublishException("Publisher is closed"));
        }

        final Pending pending = new Pending(event, System.nanoTime(), new CompletableFuture<>());
        queue.put(pending);

        // Lost the race with close(): the delivery thread will not see it
        if (closing && !deliveryThread.isAlive() && queue.remove(pending)) {
            pending.future.completeExceptionally(new PublishException("Publisher is closed"));
        }
        return pending.future;
    }

    public int buffered() {
        return queue.size();
    }

    public long publishedTotal() {
        return published.sum();
    }

    public long retriesTotal() {
        return retries.sum();
    }

    // ---- Delivery thread ----

    private void deliveryLoop() {
        final List<Pending> batch = new ArrayList<>(settings.batchSize());
        try {
            while (true) {
                final Pending first = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                metrics.gauge(KernelMetrics.PUBLISHER_BUFFERED, queue.size());
                if (first == null) {
                    if (closing) break;
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, settings.batchSize() - 1);

                deliver(batch);
                batch.clear();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Publisher delivery loop crashed", e);
        } finally {
            failAll(batch, 0, new PublishException("Publisher closed before delivery"));
            final List<Pending> rest = new ArrayList<>();
            queue.drainTo(rest);
            failAll(rest, 0, new PublishException("Publisher closed before delivery"));
            if (!rest.isEmpty()) {
                log.warn("Publisher closed with {} undelivered events", rest.size());
            }
        }
    }

    private void deliver(List<Pending> batch) throws InterruptedException {
        int from = 0;
        int attempt = 0;

        while (from < batch.size()) {
            final List<CompletableFuture<DeliveryReceipt>> sends = new ArrayList<>(batch.size() - from);
            for (int i = from; i < batch.size(); i++) {
                sends.add(send(batch.get(i).event));
            }

            int failedAt = -1;
            Throwable cause = null;
            for (int i = from; i < batch.size(); i++) {
                try {
                    final DeliveryReceipt receipt = sends.get(i - from)
                            .get(settings.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
                    complete(batch.get(i), receipt);
                } catch (ExecutionException e) {
                    failedAt = i;
                    cause = e.getCause() != null ? e.getCause() : e;
                    break;
                } catch (TimeoutException e) {
                    failedAt = i;
                    cause = e;
                    break;
                }
            }

            if (failedAt < 0) {
                return;
            }

            // Redeliver from the first unacknowledged event; later ones may be duplicated, never reordered
            from = failedAt;
            attempt++;
            retries.increment();
            metrics.counter(KernelMetrics.PUBLISH_RETRIES);
            errorLog.report("Bus delivery failed (attempt " + attempt + ", " + (batch.size() - from) + " pending)", cause);

            markStale(batch, from);

            if (closing && System.nanoTime() - closeDeadlineNanos > 0) {
                failAll(batch, from, new PublishException("Bus unreachable at shutdown", cause));
                return;
            }
            sleep(settings.retryBackoff().delay(attempt));
        }
    }

    private CompletableFuture<DeliveryReceipt> send(NormalizedEvent event) {
        try {
            return bus.send(event);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void complete(Pending p, DeliveryReceipt receipt) {
        published.increment();
        metrics.counter(KernelMetrics.EVENTS_PUBLISHED);
        final String sourceId = p.event.sourceId();
        if (degradedSources.remove(sourceId)) {
            log.info("Delivery recovered for source '{}'", sourceId);
            notifyHealth(sourceId, false);
        }
        p.future.complete(receipt);
    }

    private void markStale(List<Pending> batch, int from) {
        final long staleNanos = settings.staleness().toNanos();
        final long now = System.nanoTime();
        final Set<String> stale = new LinkedHashSet<>();

        for (int i = from; i < batch.size(); i++) {
            Pending p = batch.get(i);
            if (now - p.enqueuedNanos > staleNanos) stale.add(p.event.sourceId());
        }
        // Weakly consistent iteration; good enough for a health signal
        for (Pending p : queue) {
            if (now - p.enqueuedNanos > staleNanos) stale.add(p.event.sourceId());
        }

        for (String sourceId : stale) {
            if (degradedSources.add(sourceId)) {
                log.warn("Source '{}' degraded: events undelivered for more than {}", sourceId, settings.staleness());
                notifyHealth(sourceId, true);
            }
        }
    }

    private void notifyHealth(String sourceId, boolean degraded) {
        try {
            healthListener.onDeliveryHealth(sourceId, degraded);
        } catch (RuntimeException e) {
            log.warn("Delivery health listener failed for '{}'", sourceId, e);
        }
    }

    private void sleep(Duration delay) throws InterruptedException {
        long remaining = delay.toMillis();
        while (remaining > 0) {
            if (closing && System.nanoTime() - closeDeadlineNanos > 0) return;
            long step = Math.min(remaining, POLL_MS);
            Thread.sleep(step);
            remaining -= step;
        }
    }

    private static void failAll(List<Pending> items, int from, Throwable cause) {
        for (int i = from; i < items.size(); i++) {
            items.get(i).future.completeExceptionally(cause);
        }
    }

    // ---- Lifecycle ----

    /**
     * Stops accepting events and keeps delivering what is buffered until the bus drains it or
     * {@code timeout} passes; anything left then fails its future.
     */
    public void close(Duration timeout) {
        if (closing) return;
        closeDeadlineNanos = System.nanoTime() + timeout.toNanos();
        closing = true;
        if (!started.get()) {
            return;
        }
        log.info("Closing Publisher ({} buffered)...", queue.size());
        try {
            deliveryThread.join(timeout.toMillis() + POLL_MS * 5);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (deliveryThread.isAlive()) {
            log.warn("Publisher delivery thread did not finish in {}; interrupting", timeout);
            deliveryThread.interrupt();
        }
        log.info("Publisher closed. published={} retries={}", published.sum(), retries.sum());
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(10));
    }

    private static final class Pending {
        final NormalizedEvent event;
        final long enqueuedNanos;
        final CompletableFuture<DeliveryReceipt> future;

        Pending(NormalizedEvent event, long enqueuedNanos, CompletableFuture<DeliveryReceipt> future) {
            this.event = event;
            this.enqueuedNanos = enqueuedNanos;
            this.future = future;
        }
    }
}
