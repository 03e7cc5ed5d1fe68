/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.CacheException;
import com.intuitivedesigns.chainkernel.error.RegistryException;
import com.intuitivedesigns.chainkernel.error.UnknownDecoderException;
import com.intuitivedesigns.chainkernel.metrics.KernelMetrics;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.model.RegistryChange;
import com.intuitivedesigns.chainkernel.model.RegistrySnapshot;
import com.intuitivedesigns.chainkernel.model.SourceConfig;
import com.intuitivedesigns.chainkernel.model.WorkerState;
import com.intuitivedesigns.chainkernel.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the live set of {@link SourceWorker}s equal to the enabled set of registry entries.
 *
 * <p>Threads:</p>
 * <ul>
 *   <li><b>reconciliation loop</b>: the only code that touches worker handles and {@link WorkerState}.
 *       Everything else (registry watcher, workers, publisher, timers) posts messages to its inbox.</li>
 *   <li><b>registry watcher</b>: list, then watch; on failure back off, re-list and re-watch.</li>
 *   <li>one thread per worker.</li>
 * </ul>
 *
 * <p>Stops are two-phase: request, wait up to the stop timeout, then cancel with interrupt.
 * A replacement worker for the same source is launched only after the old one has exited, so at
 * most one worker per source id runs at any instant.</p>
 */
public final class Supervisor implements DeliveryHealthListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    private static final Duration FORCE_GRACE = Duration.ofSeconds(2);

    private final ConfigStore store;
    private final WorkerResources resources;
    private final SupervisorSettings settings;
    private final MetricsRuntime metrics;

    private final LinkedBlockingQueue<Message> inbox = new LinkedBlockingQueue<>();
    private final ExecutorService workerPool;
    private final ScheduledExecutorService timer;
    private final Thread loopThread;
    private final Thread watcherThread;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile boolean watcherRunning;
    private volatile RegistryWatch currentWatch;

    private volatile Map<String, WorkerState> snapshot = Map.of();
    private volatile int liveWorkers;

    // ---- Owned by the reconciliation loop ----
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private long generationSeq;
    private boolean shuttingDown;
    private boolean gaveUp;

    public Supervisor(ConfigStore store, WorkerResources resources, SupervisorSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = resources.metrics();

        this.workerPool = Executors.newCachedThreadPool(new NamedDaemonThreadFactory("ck-worker-"));
        this.timer = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("ck-supervisor-timer-"));
        this.loopThread = new Thread(this::loop, "ck-supervisor");
        this.watcherThread = new Thread(this::watchLoop, "ck-registry-watch");
        this.watcherThread.setDaemon(true);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        watcherRunning = true;
        loopThread.start();
        watcherThread.start();
        log.info("Supervisor started. crashloop={}/{} stopTimeout={} shutdownTimeout={}",
                settings.crashLoopMaxRestarts(), settings.crashLoopWindow(),
                settings.stopTimeout(), settings.shutdownTimeout());
    }

    // ---- Read-only operational surface ----

    /**
     * Immutable view of every known source's health, republished after each reconciliation step.
     */
    public Map<String, WorkerState> snapshot() {
        return snapshot;
    }

    public Optional<WorkerState> state(String sourceId) {
        return Optional.ofNullable(snapshot.get(sourceId));
    }

    /**
     * Number of worker threads currently alive (including ones being stopped).
     */
    public int liveWorkers() {
        return liveWorkers;
    }

    // ---- Inbound signals (any thread) ----

    @Override
    public void onDeliveryHealth(String sourceId, boolean degraded) {
        post(new DeliveryHealth(sourceId, degraded));
    }

    private void onReport(WorkerReport report) {
        post(new Report(report));
    }

    private void post(Message message) {
        inbox.offer(message);
    }

    // ---- Shutdown ----

    /**
     * Stops the watcher and every worker, waiting up to the shutdown timeout for clean exits and
     * force-cancelling the rest.
     *
     * @return true if every worker exited
     */
    public boolean shutdown() {
        if (!started.get()) {
            terminated.countDown();
            return true;
        }
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("Supervisor shutdown requested");
            post(new Shutdown());
        }
        try {
            final long waitMs = settings.shutdownTimeout().plus(FORCE_GRACE).plusSeconds(1).toMillis();
            if (!terminated.await(waitMs, TimeUnit.MILLISECONDS)) {
                log.error("Supervisor did not terminate within {}ms", waitMs);
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return liveWorkers == 0;
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---- Reconciliation loop ----

    private void loop() {
        try {
            while (true) {
                final Message m = inbox.take();
                try {
                    handle(m);
                } catch (RuntimeException e) {
                    log.error("Reconciliation step failed for {}", m, e);
                }
                publishSnapshot();
                if (shuttingDown && (countLive() == 0 || gaveUp)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            for (Entry e : entries.values()) {
                if (e.handle == null && e.state.status() != WorkerStatus.FAILED) {
                    e.state = e.state.withStatus(WorkerStatus.STOPPED);
                }
            }
            publishSnapshot();
            timer.shutdownNow();
            workerPool.shutdownNow();
            log.info("Supervisor stopped ({} workers still alive)", countLive());
            terminated.countDown();
        }
    }

    private void handle(Message m) {
        if (m instanceof Snapshot s) {
            applySnapshot(s.snapshot());
        } else if (m instanceof Change c) {
            applyChange(c.change());
        } else if (m instanceof Report r) {
            applyReport(r.report());
        } else if (m instanceof DeliveryHealth h) {
            applyHealth(h.sourceId(), h.degraded());
        } else if (m instanceof RestartDue r) {
            Entry e = entries.get(r.sourceId());
            if (e != null && e.restartToken == r.token() && e.handle == null) {
                reconcile(e);
            }
        } else if (m instanceof StopDeadline d) {
            Entry e = entries.get(d.sourceId());
            if (e != null && e.handle != null && e.handle.worker.generation() == d.generation()) {
                forceStop(e);
            }
        } else if (m instanceof Shutdown) {
            beginShutdown();
        } else if (m instanceof ShutdownDeadline) {
            for (Entry e : new ArrayList<>(entries.values())) {
                if (e.handle != null) forceStop(e);
            }
            timer.schedule(() -> post(new ShutdownGiveUp()), FORCE_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } else if (m instanceof ShutdownGiveUp) {
            if (countLive() > 0) {
                log.error("{} workers ignored cancellation; abandoning them", countLive());
            }
            gaveUp = true;
        }
    }

    private void applySnapshot(RegistrySnapshot snap) {
        if (shuttingDown) return;
        log.info("Registry snapshot: {} sources ({} invalid)", snap.configs().size(), snap.invalid().size());

        final Set<String> present = new HashSet<>();
        for (SourceConfig cfg : snap.configs()) {
            present.add(cfg.id());
            applyPut(cfg, false);
        }
        for (Map.Entry<String, String> invalid : snap.invalid().entrySet()) {
            present.add(invalid.getKey());
            applyInvalid(invalid.getKey(), invalid.getValue());
        }
        // A snapshot is the full desired state: anything missing was deleted while we were not watching
        for (String id : new ArrayList<>(entries.keySet())) {
            if (!present.contains(id)) {
                applyDelete(id);
            }
        }
    }

    private void applyChange(RegistryChange change) {
        if (shuttingDown) return;
        switch (change.type()) {
            case PUT:
                applyPut(change.config(), true);
                break;
            case DELETE:
                applyDelete(change.sourceId());
                break;
            case INVALID:
                applyInvalid(change.sourceId(), change.error());
                break;
            default:
                throw new IllegalStateException("Unhandled change type " + change.type());
        }
    }

    /**
     * @param touch true for an explicit registry write; a re-touch is what clears a failed source
     */
    private void applyPut(SourceConfig cfg, boolean touch) {
        Entry e = entries.get(cfg.id());
        if (e == null) {
            e = new Entry(cfg.id(), newGuard());
            e.config = cfg;
            entries.put(cfg.id(), e);
            log.info("Source '{}' added (chain={}, enabled={})", cfg.id(), cfg.chainType(), cfg.enabled());
            reconcile(e);
            return;
        }

        final boolean changed = !cfg.equals(e.config);

        if (e.deleted) {
            // Re-created while the old worker is still stopping; it starts fresh once that one exits
            e.deleted = false;
            e.failed = false;
            e.guard.reset();
            e.state = WorkerState.initial(cfg.id());
            e.config = cfg;
            reconcile(e);
            return;
        }

        if (e.failed) {
            if (!touch && !changed) return;
            log.info("Source '{}' re-touched; clearing failed state", cfg.id());
            e.failed = false;
            e.guard.reset();
            e.state = e.state.resetRestarts().withError(WorkerStatus.STOPPED, null);
            e.config = cfg;
            e.restartToken++;
            reconcile(e);
            return;
        }

        if (!changed) return;

        log.info("Source '{}' changed; restarting worker", cfg.id());
        e.config = cfg;
        e.restartToken++;
        if (e.handle != null) {
            requestStop(e); // replacement is launched from the exit report
        } else {
            reconcile(e);
        }
    }

    private void applyDelete(String sourceId) {
        final Entry e = entries.get(sourceId);
        if (e == null || e.deleted) return;

        log.info("Source '{}' deleted", sourceId);
        e.deleted = true;
        e.purgeCheckpoint = true;
        e.restartToken++;
        if (e.handle != null) {
            requestStop(e);
        } else {
            finalizeDelete(e);
        }
    }

    private void applyInvalid(String sourceId, String error) {
        metrics.counter(KernelMetrics.CONFIG_ERRORS);
        final Entry e = entries.get(sourceId);
        if (e != null && !e.deleted) {
            log.warn("Ignoring unparseable update for source '{}', keeping previous config: {}", sourceId, error);
        } else {
            log.warn("Skipping unparseable source '{}': {}", sourceId, error);
        }
    }

    private void applyHealth(String sourceId, boolean degraded) {
        final Entry e = entries.get(sourceId);
        if (e != null && e.state.degraded() != degraded) {
            e.state = e.state.withDegraded(degraded);
        }
    }

    private void applyReport(WorkerReport r) {
        final Entry e = entries.get(r.sourceId());
        if (e == null || e.handle == null || e.handle.worker.generation() != r.generation()) {
            return; // from a worker that has already been replaced
        }

        switch (r.kind()) {
            case STATUS:
                e.state = e.state.withHeartbeat(r.at());
                if (e.failed) break;
                if (r.status() == WorkerStatus.BACKOFF) {
                    e.state = e.state.withError(WorkerStatus.BACKOFF, r.error());
                    countRestart(e, r.error());
                } else {
                    e.state = e.state.withStatus(r.status());
                }
                break;
            case HEARTBEAT:
                e.state = e.state.withHeartbeat(r.at());
                break;
            case FATAL:
                markFailed(e, r.error());
                break;
            case EXITED:
                onExited(e, r.error());
                break;
            default:
                throw new IllegalStateException("Unhandled report kind " + r.kind());
        }
    }

    private void onExited(Entry e, String error) {
        final WorkerHandle exited = e.handle;
        e.handle = null;

        if (!exited.stopping && !e.failed && !e.deleted && !shuttingDown) {
            log.warn("Worker for source '{}' exited unexpectedly: {}", e.id, error);
            e.state = e.state.withError(WorkerStatus.BACKOFF, error != null ? error : "worker exited unexpectedly");
            countRestart(e, e.state.lastError());
            if (!e.failed) {
                scheduleRestart(e);
                return;
            }
        }

        if (e.deleted) {
            finalizeDelete(e);
            return;
        }
        if (e.failed) {
            e.state = e.state.withStatus(WorkerStatus.FAILED);
            return;
        }
        e.state = e.state.withStatus(WorkerStatus.STOPPED);
        reconcile(e);
    }

    /**
     * Converges one source toward its desired state once it has no live worker.
     */
    private void reconcile(Entry e) {
        if (e.handle != null) return;
        if (e.deleted) {
            finalizeDelete(e);
            return;
        }
        if (e.purgeCheckpoint) {
            deleteCheckpoint(e.id);
            e.purgeCheckpoint = false;
        }
        if (e.failed) return;
        if (shuttingDown || !e.config.enabled()) {
            e.state = e.state.withStatus(WorkerStatus.STOPPED);
            return;
        }
        if (!resources.decoders().supports(e.config.chainType())) {
            markFailed(e, new UnknownDecoderException(e.config.chainType()).getMessage());
            return;
        }
        launch(e);
    }

    private void launch(Entry e) {
        final long generation = ++generationSeq;
        final SourceWorker worker = new SourceWorker(e.config, generation, resources, this::onReport);
        final Future<?> future = workerPool.submit(worker);
        e.handle = new WorkerHandle(worker, future);
        e.state = e.state.withStatus(WorkerStatus.STARTING);
        log.debug("Launched worker for '{}' (generation {})", e.id, generation);
    }

    private void requestStop(Entry e) {
        final WorkerHandle h = e.handle;
        if (h == null || h.stopping) return;
        h.stopping = true;
        h.worker.requestStop();
        final String id = e.id;
        final long generation = h.worker.generation();
        timer.schedule(() -> post(new StopDeadline(id, generation)),
                settings.stopTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void forceStop(Entry e) {
        final WorkerHandle h = e.handle;
        log.warn("Worker for source '{}' did not stop in time; cancelling", e.id);
        h.stopping = true;
        h.worker.requestStop();
        h.future.cancel(true);
        if (h.worker.cancelBeforeStart()) {
            // Never ran, so no exit report will arrive
            onExited(e, null);
        }
    }

    private void countRestart(Entry e, String error) {
        metrics.counter(KernelMetrics.WORKER_RESTARTS);
        e.state = e.state.withRestart();
        if (e.guard.record(now())) {
            markFailed(e, "crash loop: more than " + settings.crashLoopMaxRestarts() + " restarts within "
                    + settings.crashLoopWindow() + (error == null ? "" : "; last error: " + error));
        }
    }

    private void markFailed(Entry e, String error) {
        log.error("Source '{}' failed: {}", e.id, error);
        e.failed = true;
        e.restartToken++;
        e.state = e.state.withError(WorkerStatus.FAILED, error);
        requestStop(e);
    }

    private void scheduleRestart(Entry e) {
        final Duration delay = settings.restartBackoff().delay(Math.max(1, e.guard.recent(now())));
        final String id = e.id;
        final long token = ++e.restartToken;
        timer.schedule(() -> post(new RestartDue(id, token)), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void finalizeDelete(Entry e) {
        deleteCheckpoint(e.id);
        entries.remove(e.id);
        log.info("Source '{}' removed", e.id);
    }

    private void deleteCheckpoint(String sourceId) {
        try {
            resources.checkpoints().delete(sourceId);
        } catch (CacheException ex) {
            metrics.counter(KernelMetrics.CACHE_ERRORS);
            log.warn("Failed to delete checkpoint for '{}': {}", sourceId, ex.getMessage());
        }
    }

    private void beginShutdown() {
        if (shuttingDown) return;
        shuttingDown = true;
        stopWatcher();
        log.info("Stopping {} workers (timeout {})", countLive(), settings.shutdownTimeout());
        for (Entry e : entries.values()) {
            e.restartToken++;
            if (e.handle != null) requestStop(e);
        }
        timer.schedule(() -> post(new ShutdownDeadline()),
                settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void publishSnapshot() {
        final Map<String, WorkerState> out = new LinkedHashMap<>();
        final int[] byStatus = new int[WorkerStatus.values().length];
        for (Entry e : entries.values()) {
            out.put(e.id, e.state);
            byStatus[e.state.status().ordinal()]++;
        }
        snapshot = Collections.unmodifiableMap(out);
        liveWorkers = countLive();
        metrics.gauge(KernelMetrics.WORKERS_RUNNING, byStatus[WorkerStatus.RUNNING.ordinal()]);
        for (WorkerStatus status : WorkerStatus.values()) {
            metrics.taggedGauge(KernelMetrics.WORKERS, byStatus[status.ordinal()],
                    KernelMetrics.TAG_STATUS, status.label());
        }
    }

    private int countLive() {
        int live = 0;
        for (Entry e : entries.values()) {
            if (e.handle != null) live++;
        }
        return live;
    }

    private CrashLoopGuard newGuard() {
        return new CrashLoopGuard(settings.crashLoopMaxRestarts(), settings.crashLoopWindow());
    }

    private Instant now() {
        return resources.clock().instant();
    }

    // ---- Registry watcher ----

    private void watchLoop() {
        int attempt = 0;
        while (watcherRunning) {
            try {
                final RegistrySnapshot snap = store.list();
                post(new Snapshot(snap));
                attempt = 0;
                try (RegistryWatch watch = store.watch(snap.cursor())) {
                    currentWatch = watch;
                    while (watcherRunning) {
                        final RegistryChange change = watch.next(settings.watchPollTimeout());
                        if (change != null) {
                            post(new Change(change));
                        }
                    }
                } finally {
                    currentWatch = null;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RegistryException | RuntimeException e) {
                if (!watcherRunning) break;
                attempt++;
                final Duration delay = settings.registryRetry().delay(attempt);
                log.warn("Registry watch failed (attempt {}); re-listing in {}ms: {}", attempt, delay.toMillis(), e.getMessage());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("Registry watcher stopped");
    }

    private void stopWatcher() {
        watcherRunning = false;
        final RegistryWatch watch = currentWatch;
        if (watch != null) {
            try {
                watch.close();
            } catch (RuntimeException e) {
                log.debug("Closing registry watch failed", e);
            }
        }
        watcherThread.interrupt();
    }

    // ---- Loop-owned bookkeeping ----

    private static final class Entry {
        final String id;
        final CrashLoopGuard guard;
        SourceConfig config;
        WorkerHandle handle;
        WorkerState state;
        boolean failed;
        boolean deleted;
        boolean purgeCheckpoint;
        long restartToken;

        Entry(String id, CrashLoopGuard guard) {
            this.id = id;
            this.guard = guard;
            this.state = WorkerState.initial(id);
        }
    }

    private static final class WorkerHandle {
        final SourceWorker worker;
        final Future<?> future;
        boolean stopping;

        WorkerHandle(SourceWorker worker, Future<?> future) {
            this.worker = worker;
            this.future = future;
        }
    }

    // ---- Inbox messages ----

    private interface Message {}

    private record Snapshot(RegistrySnapshot snapshot) implements Message {}

    private record Change(RegistryChange change) implements Message {}

    private record Report(WorkerReport report) implements Message {}

    private record DeliveryHealth(String sourceId, boolean degraded) implements Message {}

    private record RestartDue(String sourceId, long token) implements Message {}

    private record StopDeadline(String sourceId, long generation) implements Message {}

    private record Shutdown() implements Message {}

    private record ShutdownDeadline() implements Message {}

    private record ShutdownGiveUp() implements Message {}

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger();

        private NamedDaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
