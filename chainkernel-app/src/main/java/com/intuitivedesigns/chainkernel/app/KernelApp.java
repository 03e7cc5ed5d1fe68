/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.app;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.config.KernelFactory;
import com.intuitivedesigns.chainkernel.core.CheckpointStore;
import com.intuitivedesigns.chainkernel.core.ConfigStore;
import com.intuitivedesigns.chainkernel.core.ConnectionFactory;
import com.intuitivedesigns.chainkernel.core.DecoderRegistry;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.core.DedupMarker;
import com.intuitivedesigns.chainkernel.core.EventBus;
import com.intuitivedesigns.chainkernel.core.Publisher;
import com.intuitivedesigns.chainkernel.core.PublisherSettings;
import com.intuitivedesigns.chainkernel.core.Supervisor;
import com.intuitivedesigns.chainkernel.core.SupervisorSettings;
import com.intuitivedesigns.chainkernel.core.WorkerResources;
import com.intuitivedesigns.chainkernel.core.WorkerSettings;
import com.intuitivedesigns.chainkernel.error.BootstrapException;
import com.intuitivedesigns.chainkernel.health.HealthSnapshotServer;
import com.intuitivedesigns.chainkernel.metrics.MetricsFactory;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.metrics.MetricsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process entry point: boot, run the supervisor until SIGTERM/SIGINT, drain, exit.
 *
 * <p>Exit code 1 when bootstrap fails (registry, bus or caches unreachable, bad plugin config).</p>
 */
public final class KernelApp {

    private static final Logger log = LoggerFactory.getLogger(KernelApp.class);

    // --- Config Keys ---
    private static final String CFG_STATUS_ENABLED = "kernel.status.enabled";
    private static final String CFG_STATUS_WINDOW_SECONDS = "kernel.status.window.seconds";

    // --- Defaults ---
    private static final int DEFAULT_WINDOW_SECONDS = 30;
    private static final int MIN_WINDOW_SECONDS = 5;
    private static final int MAX_WINDOW_SECONDS = 300;

    private KernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting ChainKernel ===");

        final KernelConfig config;
        try {
            config = KernelConfig.get();
        } catch (RuntimeException e) {
            log.error("Failed to load bootstrap configuration", e);
            System.exit(1);
            return;
        }
        KernelFactory.logAvailablePlugins();

        MetricsRuntime metrics = null;
        ConfigStore registry = null;
        EventBus bus = null;
        DedupCache dedup = null;
        DedupMarker dedupMarks = null;
        CheckpointStore checkpoints = null;
        ConnectionFactory connections = null;
        Publisher publisher = null;
        Supervisor supervisor = null;
        HealthSnapshotServer health = null;
        ScheduledExecutorService statusScheduler = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 2. Collaborators (SPI) + reachability
            registry = KernelFactory.createRegistry(config, metrics);
            bus = KernelFactory.createBus(config, metrics);
            dedup = KernelFactory.createDedup(config, metrics);
            checkpoints = KernelFactory.createCheckpoints(config, metrics);
            connections = KernelFactory.createConnections(config, metrics);
            final DecoderRegistry decoders = KernelFactory.createDecoders(config, metrics);

            KernelFactory.verifyRegistry(registry);
            KernelFactory.verifyBus(bus);
            KernelFactory.verifyCaches(dedup, checkpoints);
            log.info("Chain types: {}", decoders.chainTypes());

            // 3. Publisher + supervisor
            publisher = new Publisher(bus, PublisherSettings.from(config), metrics);
            dedupMarks = DedupMarker.from(config, dedup, metrics);
            final WorkerResources resources = new WorkerResources(decoders, connections, dedup, dedupMarks, checkpoints,
                    publisher, WorkerSettings.from(config), metrics, Clock.systemUTC());
            supervisor = new Supervisor(registry, resources, SupervisorSettings.from(config));
            publisher.setHealthListener(supervisor);

            // 4. Optional health endpoint
            final int healthPort = config.getInt(HealthSnapshotServer.KEY_PORT, -1);
            if (healthPort >= 0) {
                health = HealthSnapshotServer.start(healthPort, supervisor::snapshot);
            }

            // 5. Status line
            if (config.getBoolean(CFG_STATUS_ENABLED, true)) {
                final int windowSeconds = clampInt(config.getInt(CFG_STATUS_WINDOW_SECONDS, DEFAULT_WINDOW_SECONDS),
                        MIN_WINDOW_SECONDS, MAX_WINDOW_SECONDS);
                statusScheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("ck-status"));
                statusScheduler.scheduleAtFixedRate(new StatusReporter(supervisor::snapshot, publisher, windowSeconds),
                        windowSeconds, windowSeconds, TimeUnit.SECONDS);
            }

            // 6. Shutdown hook
            final Resources owned = new Resources(metrics, registry, bus, dedup, dedupMarks, checkpoints, connections,
                    publisher, supervisor, health, statusScheduler);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }
                log.info("Shutdown signal received.");
                try {
                    owned.stop();
                } finally {
                    shutdownLatch.countDown();
                }
            }, "ck-shutdown"));

            // 7. Launch
            publisher.start();
            supervisor.start();
            log.info("ChainKernel running.");

            shutdownLatch.await();
        } catch (BootstrapException e) {
            log.error("Bootstrap failed: {}", e.getMessage(), e.getCause());
            stopOnFailure(shutdownStarted, new Resources(metrics, registry, bus, dedup, dedupMarks, checkpoints, connections,
                    publisher, supervisor, health, statusScheduler));
            System.exit(1);
        } catch (Throwable t) {
            log.error("Fatal application error", t);
            stopOnFailure(shutdownStarted, new Resources(metrics, registry, bus, dedup, dedupMarks, checkpoints, connections,
                    publisher, supervisor, health, statusScheduler));
            System.exit(1);
        }
    }

    private static void stopOnFailure(AtomicBoolean shutdownStarted, Resources resources) {
        if (shutdownStarted.compareAndSet(false, true)) {
            resources.stop();
        }
    }

    /**
     * Everything the process owns, stopped in dependency order: no new records, drain the
     * publisher, then release clients.
     */
    private record Resources(MetricsRuntime metrics,
                             ConfigStore registry,
                             EventBus bus,
                             DedupCache dedup,
                             DedupMarker dedupMarks,
                             CheckpointStore checkpoints,
                             ConnectionFactory connections,
                             Publisher publisher,
                             Supervisor supervisor,
                             HealthSnapshotServer health,
                             ScheduledExecutorService statusScheduler) {

        void stop() {
            if (statusScheduler != null) {
                statusScheduler.shutdownNow();
            }
            if (supervisor != null) {
                final boolean clean = supervisor.shutdown();
                log.info("Supervisor stopped ({})", clean ? "clean" : "some workers force-cancelled");
            }
            closeQuietly(health);
            closeQuietly(publisher);
            closeQuietly(bus);
            closeQuietly(connections);
            closeQuietly(dedupMarks);
            closeQuietly(dedup);
            closeQuietly(checkpoints);
            closeQuietly(registry);
            closeQuietly(metrics);
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}", resource.getClass().getSimpleName(), e);
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
