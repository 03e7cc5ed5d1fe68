/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.config.KernelConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Supervisor tuning.
 *
 * @param crashLoopMaxRestarts restarts tolerated inside {@code crashLoopWindow}; one more marks the source failed
 * @param crashLoopWindow      rolling window for counting restarts
 * @param stopTimeout          grace period between a stop request and a forced cancel
 * @param shutdownTimeout      overall bound for a process shutdown
 * @param restartBackoff       delay before relaunching a worker that crashed
 * @param registryRetry        delay before re-listing after a registry failure
 * @param watchPollTimeout     max block on the registry watch before re-checking for shutdown
 */
public record SupervisorSettings(int crashLoopMaxRestarts,
                                 Duration crashLoopWindow,
                                 Duration stopTimeout,
                                 Duration shutdownTimeout,
                                 BackoffPolicy restartBackoff,
                                 BackoffPolicy registryRetry,
                                 Duration watchPollTimeout) {

    public static final String KEY_CRASHLOOP_MAX = "supervisor.crashloop.max.restarts";
    public static final String KEY_CRASHLOOP_WINDOW_MS = "supervisor.crashloop.window.ms";
    public static final String KEY_STOP_TIMEOUT_MS = "supervisor.stop.timeout.ms";
    public static final String KEY_SHUTDOWN_TIMEOUT_MS = "supervisor.shutdown.timeout.ms";
    public static final String KEY_RESTART_INITIAL_MS = "supervisor.restart.initial.ms";
    public static final String KEY_RESTART_MAX_MS = "supervisor.restart.max.ms";
    public static final String KEY_REGISTRY_RETRY_INITIAL_MS = "registry.retry.initial.ms";
    public static final String KEY_REGISTRY_RETRY_MAX_MS = "registry.retry.max.ms";
    public static final String KEY_WATCH_POLL_MS = "registry.watch.poll.ms";

    public SupervisorSettings {
        if (crashLoopMaxRestarts < 0) throw new IllegalArgumentException(KEY_CRASHLOOP_MAX + " must be >= 0");
        Objects.requireNonNull(crashLoopWindow, "crashLoopWindow");
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(restartBackoff, "restartBackoff");
        Objects.requireNonNull(registryRetry, "registryRetry");
        Objects.requireNonNull(watchPollTimeout, "watchPollTimeout");
    }

    public static SupervisorSettings from(KernelConfig config) {
        return new SupervisorSettings(
                config.getInt(KEY_CRASHLOOP_MAX, 5),
                config.getMillis(KEY_CRASHLOOP_WINDOW_MS, 60_000L),
                config.getMillis(KEY_STOP_TIMEOUT_MS, 10_000L),
                config.getMillis(KEY_SHUTDOWN_TIMEOUT_MS, 15_000L),
                new BackoffPolicy(
                        config.getMillis(KEY_RESTART_INITIAL_MS, 1_000L),
                        config.getMillis(KEY_RESTART_MAX_MS, 60_000L),
                        0.2),
                new BackoffPolicy(
                        config.getMillis(KEY_REGISTRY_RETRY_INITIAL_MS, 500L),
                        config.getMillis(KEY_REGISTRY_RETRY_MAX_MS, 30_000L),
                        0.2),
                config.getMillis(KEY_WATCH_POLL_MS, 1_000L)
        );
    }
}
