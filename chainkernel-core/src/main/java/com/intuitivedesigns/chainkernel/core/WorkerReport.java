/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.model.WorkerStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Message from a {@link SourceWorker} to the supervisor. Workers never touch supervisor state directly.
 *
 * @param generation identifies the worker instance; reports from a replaced worker are ignored
 * @param status     the worker's state for {@link Kind#STATUS}; null otherwise
 * @param error      last error, if any
 */
public record WorkerReport(String sourceId,
                           long generation,
                           Kind kind,
                           WorkerStatus status,
                           String error,
                           Instant at) {

    public enum Kind {
        /** Entered STARTING, RUNNING or BACKOFF. */
        STATUS,
        /** Still running. */
        HEARTBEAT,
        /** Cannot ever run with this config (no decoder). */
        FATAL,
        /** Thread exited. A null error means a requested stop. */
        EXITED
    }

    public WorkerReport {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(at, "at");
        if (kind == Kind.STATUS) Objects.requireNonNull(status, "status");
    }
}
