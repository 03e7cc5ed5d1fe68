/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.CacheException;
import com.intuitivedesigns.chainkernel.error.DecodeException;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import com.intuitivedesigns.chainkernel.error.UnknownDecoderException;
import com.intuitivedesigns.chainkernel.logging.ThrottledLog;
import com.intuitivedesigns.chainkernel.metrics.KernelMetrics;
import com.intuitivedesigns.chainkernel.model.ChainPosition;
import com.intuitivedesigns.chainkernel.model.Checkpoint;
import com.intuitivedesigns.chainkernel.model.DeliveryReceipt;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RawRecord;
import com.intuitivedesigns.chainkernel.model.SourceConfig;
import com.intuitivedesigns.chainkernel.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

/**
 * Owns the single live connection to one source: read, decode, de-duplicate, publish, checkpoint.
 *
 * <p>Lifecycle: {@code STARTING -> RUNNING <-> BACKOFF}, exiting only after {@link #requestStop()}
 * (or a forced interrupt). Every state change is sent to the supervisor as a {@link WorkerReport};
 * the worker never reads or writes supervisor state.</p>
 *
 * <p>Checkpoints are written at a bounded cadence and only for positions whose events the bus has
 * acknowledged, so a restart never skips an undelivered event.</p>
 */
public final class SourceWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SourceWorker.class);

    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;

    private final SourceConfig config;
    private final long generation;
    private final WorkerResources res;
    private final WorkerSettings settings;
    private final Consumer<WorkerReport> reports;

    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private volatile boolean stopRequested;

    // ---- Owned by the worker thread ----
    private ChainPosition lastPosition;
    private ChainPosition savedPosition;
    private CompletableFuture<DeliveryReceipt> lastDelivery;
    private PendingCheckpoint pendingCheckpoint;
    private int recordsSinceCheckpoint;
    private long lastCheckpointNanos;
    private int attempt;

    private final LongAdder decodeFailures = new LongAdder();
    private final ThrottledLog errorLog = ThrottledLog.warn(log, ERROR_LOG_INTERVAL_MS);

    public SourceWorker(SourceConfig config, long generation, WorkerResources resources, Consumer<WorkerReport> reports) {
        this.config = Objects.requireNonNull(config, "config");
        this.generation = generation;
        this.res = Objects.requireNonNull(resources, "resources");
        this.settings = resources.settings();
        this.reports = Objects.requireNonNull(reports, "reports");
    }

    public SourceConfig config() {
        return config;
    }

    public long generation() {
        return generation;
    }

    /**
     * First phase of a stop: the worker finishes the record in hand, flushes its checkpoint and exits.
     */
    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public long decodeFailures() {
        return decodeFailures.sum();
    }

    /**
     * Prevents a not-yet-started worker from ever running.
     *
     * @return true if the worker had not started and now never will
     */
    boolean cancelBeforeStart() {
        return claimed.compareAndSet(false, true);
    }

    @Override
    public void run() {
        if (!claimed.compareAndSet(false, true)) {
            return;
        }
        String exitError = "worker crashed";
        try {
            runLoop();
            exitError = null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitError = stopRequested ? null : "interrupted";
        } catch (RuntimeException e) {
            log.error("Worker for source '{}' crashed", config.id(), e);
            exitError = "crashed: " + e;
        } finally {
            flushCheckpoint();
            report(WorkerReport.Kind.EXITED, null, exitError);
            log.info("Worker for source '{}' exited{}", config.id(), exitError == null ? "" : " (" + exitError + ")");
        }
    }

    private void runLoop() throws InterruptedException {
        report(WorkerReport.Kind.STATUS, WorkerStatus.STARTING, null);

        final ChainDecoder decoder;
        try {
            decoder = res.decoders().require(config.chainType());
        } catch (UnknownDecoderException e) {
            log.error("Source '{}' cannot start: {}", config.id(), e.getMessage());
            report(WorkerReport.Kind.FATAL, WorkerStatus.FAILED, e.getMessage());
            return;
        }
        final RpcDialect dialect = res.decoders().dialect(config.chainType()).orElse(null);

        loadCheckpoint();
        lastCheckpointNanos = System.nanoTime();

        while (!stopRequested) {
            long runningSince = 0L;
            try (SourceConnection connection = res.connections().open(config, dialect, resumeHeight())) {
                if (stopRequested) break;
                runningSince = System.nanoTime();
                log.info("Source '{}' connected to {} (resume after {})", config.id(), config.endpoint(),
                        lastPosition == null ? "start" : lastPosition);
                report(WorkerReport.Kind.STATUS, WorkerStatus.RUNNING, null);
                consume(connection, decoder, runningSince);
            } catch (SourceConnectException e) {
                if (stopRequested) break;
                if (runningSince != 0L && System.nanoTime() - runningSince >= settings.backoffResetAfter().toNanos()) {
                    attempt = 0;
                }
                attempt++;
                final Duration delay = settings.backoff().delay(attempt);
                errorLog.report("Source '" + config.id() + "' connection failed (attempt " + attempt + ", retry in " + delay.toMillis() + "ms)", e);
                report(WorkerReport.Kind.STATUS, WorkerStatus.BACKOFF, e.getMessage());
                maybeCheckpoint();
                sleepUnlessStopped(delay);
            }
        }
    }

    private void consume(SourceConnection connection, ChainDecoder decoder, long runningSince)
            throws SourceConnectException, InterruptedException {
        final long heartbeatNanos = settings.heartbeatInterval().toNanos();
        final long resetNanos = settings.backoffResetAfter().toNanos();
        long lastHeartbeat = System.nanoTime();

        while (!stopRequested) {
            final RawRecord record = connection.next(settings.pollTimeout());
            if (record != null) {
                process(decoder, record);
            }
            maybeCheckpoint();

            final long now = System.nanoTime();
            if (now - lastHeartbeat >= heartbeatNanos) {
                report(WorkerReport.Kind.HEARTBEAT, null, null);
                lastHeartbeat = now;
            }
            if (attempt > 0 && now - runningSince >= resetNanos) {
                log.debug("Source '{}' stable for {}; resetting reconnect attempts", config.id(), settings.backoffResetAfter());
                attempt = 0;
            }
        }
    }

    private void process(ChainDecoder decoder, RawRecord record) throws InterruptedException {
        if (lastPosition != null && !record.position().isAfter(lastPosition)) {
            return; // replayed after reconnect or restart
        }
        res.metrics().counter(KernelMetrics.RECORDS);

        final NormalizedEvent event;
        try {
            event = decoder.decode(record);
        } catch (DecodeException | RuntimeException e) {
            decodeFailures.increment();
            res.metrics().taggedCounter(KernelMetrics.DECODE_FAILURES, KernelMetrics.TAG_SOURCE, config.id());
            errorLog.report("Source '" + config.id() + "' skipped undecodable record at " + record.position(), e);
            advance(record.position());
            return;
        }

        if (stopRequested) {
            return;
        }

        final String dedupKey = event.dedupKey();
        if (res.dedup().seen(dedupKey)) {
            res.metrics().counter(KernelMetrics.DEDUP_HITS);
        } else {
            final CompletableFuture<DeliveryReceipt> delivery = res.publisher().publish(event);
            // Marked only after the bus acknowledged, so a crash never hides an undelivered event
            res.dedupMarks().markWhenDelivered(delivery, dedupKey, settings.dedupTtl());
            lastDelivery = delivery;
        }
        advance(record.position());
    }

    private void advance(ChainPosition position) {
        lastPosition = position;
        recordsSinceCheckpoint++;
    }

    private OptionalLong resumeHeight() {
        if (lastPosition != null) {
            // Re-read the partially processed height; records at or before lastPosition are skipped
            return OptionalLong.of(lastPosition.height());
        }
        return config.startHeight();
    }

    // ---- Checkpointing ----

    private void loadCheckpoint() {
        try {
            res.checkpoints().load(config.id()).ifPresent(cp -> {
                lastPosition = cp.position();
                savedPosition = cp.position();
                log.info("Source '{}' resuming from checkpoint {}", config.id(), cp.position());
            });
        } catch (CacheException e) {
            res.metrics().counter(KernelMetrics.CACHE_ERRORS);
            log.warn("Source '{}' checkpoint unavailable, starting from configured position: {}", config.id(), e.getMessage());
        }
    }

    private void maybeCheckpoint() {
        if (lastPosition == null || lastPosition.equals(savedPosition)) {
            return;
        }
        if (pendingCheckpoint == null) {
            final boolean due = recordsSinceCheckpoint >= settings.checkpointEveryRecords()
                    || System.nanoTime() - lastCheckpointNanos >= settings.checkpointEvery().toNanos();
            if (!due) return;
            pendingCheckpoint = new PendingCheckpoint(lastPosition, lastDelivery);
            recordsSinceCheckpoint = 0;
            lastCheckpointNanos = System.nanoTime();
        }

        final CompletableFuture<DeliveryReceipt> delivery = pendingCheckpoint.delivery;
        if (delivery != null && !delivery.isDone()) {
            return; // bus has not caught up yet
        }
        final PendingCheckpoint ready = pendingCheckpoint;
        pendingCheckpoint = null;
        if (delivery != null && delivery.isCompletedExceptionally()) {
            log.warn("Source '{}' not checkpointing {}: delivery failed", config.id(), ready.position);
            return;
        }
        save(ready.position);
    }

    /**
     * Final checkpoint on exit: waits briefly for the last delivery, never checkpoints past an unacknowledged event.
     */
    private void flushCheckpoint() {
        if (lastPosition == null || lastPosition.equals(savedPosition)) {
            return;
        }
        final CompletableFuture<DeliveryReceipt> delivery = lastDelivery;
        if (delivery != null && !delivery.isDone() && !Thread.currentThread().isInterrupted()) {
            try {
                delivery.get(settings.checkpointFlushTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.debug("Source '{}' last delivery not confirmed on exit: {}", config.id(), e.toString());
            }
        }
        if (delivery != null && (!delivery.isDone() || delivery.isCompletedExceptionally())) {
            log.warn("Source '{}' exiting with unconfirmed deliveries; checkpoint stays at {}", config.id(), savedPosition);
            return;
        }
        save(lastPosition);
    }

    private void save(ChainPosition position) {
        try {
            res.checkpoints().save(new Checkpoint(config.id(), position, res.clock().instant()));
            savedPosition = position;
            res.metrics().counter(KernelMetrics.CHECKPOINTS);
        } catch (CacheException e) {
            res.metrics().counter(KernelMetrics.CACHE_ERRORS);
            errorLog.report("Source '" + config.id() + "' checkpoint write failed", e);
        }
    }

    // ---- Helpers ----

    private void sleepUnlessStopped(Duration delay) throws InterruptedException {
        final long step = Math.max(1L, settings.pollTimeout().toMillis());
        long remaining = delay.toMillis();
        while (remaining > 0 && !stopRequested) {
            long slice = Math.min(remaining, step);
            Thread.sleep(slice);
            remaining -= slice;
        }
    }

    private void report(WorkerReport.Kind kind, WorkerStatus status, String error) {
        reports.accept(new WorkerReport(config.id(), generation, kind, status, error, res.clock().instant()));
    }

    private static final class PendingCheckpoint {
        final ChainPosition position;
        final CompletableFuture<DeliveryReceipt> delivery;

        PendingCheckpoint(ChainPosition position, CompletableFuture<DeliveryReceipt> delivery) {
            this.position = position;
            this.delivery = delivery;
        }
    }
}
