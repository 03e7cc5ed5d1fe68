/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.config.KernelConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-worker tuning, shared by every source.
 *
 * @param backoff              reconnect delays
 * @param backoffResetAfter    sustained running time after which the reconnect attempt counter resets
 * @param checkpointEveryRecords checkpoint after this many processed records
 * @param checkpointEvery      ...or after this much time, whichever comes first
 * @param checkpointFlushTimeout max wait on stop for the last delivery before the final checkpoint
 * @param dedupTtl             lifetime of dedup marks
 * @param pollTimeout          max block on the connection before re-checking for a stop request
 * @param heartbeatInterval    how often a running worker reports liveness
 */
public record WorkerSettings(BackoffPolicy backoff,
                             Duration backoffResetAfter,
                             int checkpointEveryRecords,
                             Duration checkpointEvery,
                             Duration checkpointFlushTimeout,
                             Duration dedupTtl,
                             Duration pollTimeout,
                             Duration heartbeatInterval) {

    public static final String KEY_BACKOFF_INITIAL_MS = "worker.backoff.initial.ms";
    public static final String KEY_BACKOFF_MAX_MS = "worker.backoff.max.ms";
    public static final String KEY_BACKOFF_JITTER = "worker.backoff.jitter";
    public static final String KEY_BACKOFF_RESET_AFTER_MS = "worker.backoff.reset.after.ms";
    public static final String KEY_CHECKPOINT_EVERY_RECORDS = "worker.checkpoint.every.records";
    public static final String KEY_CHECKPOINT_EVERY_MS = "worker.checkpoint.every.ms";
    public static final String KEY_CHECKPOINT_FLUSH_TIMEOUT_MS = "worker.checkpoint.flush.timeout.ms";
    public static final String KEY_DEDUP_TTL_SECONDS = "dedup.ttl.seconds";
    public static final String KEY_POLL_TIMEOUT_MS = "worker.poll.timeout.ms";
    public static final String KEY_HEARTBEAT_MS = "worker.heartbeat.ms";

    public WorkerSettings {
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(backoffResetAfter, "backoffResetAfter");
        Objects.requireNonNull(checkpointEvery, "checkpointEvery");
        Objects.requireNonNull(checkpointFlushTimeout, "checkpointFlushTimeout");
        Objects.requireNonNull(dedupTtl, "dedupTtl");
        Objects.requireNonNull(pollTimeout, "pollTimeout");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        if (checkpointEveryRecords <= 0) {
            throw new IllegalArgumentException(KEY_CHECKPOINT_EVERY_RECORDS + " must be > 0");
        }
    }

    public static WorkerSettings from(KernelConfig config) {
        return new WorkerSettings(
                new BackoffPolicy(
                        config.getMillis(KEY_BACKOFF_INITIAL_MS, 500L),
                        config.getMillis(KEY_BACKOFF_MAX_MS, 30_000L),
                        config.getDouble(KEY_BACKOFF_JITTER, 0.2)),
                config.getMillis(KEY_BACKOFF_RESET_AFTER_MS, 60_000L),
                config.getInt(KEY_CHECKPOINT_EVERY_RECORDS, 500),
                config.getMillis(KEY_CHECKPOINT_EVERY_MS, 5_000L),
                config.getMillis(KEY_CHECKPOINT_FLUSH_TIMEOUT_MS, 5_000L),
                Duration.ofSeconds(Math.max(1L, config.getLong(KEY_DEDUP_TTL_SECONDS, 86_400L))),
                config.getMillis(KEY_POLL_TIMEOUT_MS, 250L),
                config.getMillis(KEY_HEARTBEAT_MS, 5_000L)
        );
    }
}
