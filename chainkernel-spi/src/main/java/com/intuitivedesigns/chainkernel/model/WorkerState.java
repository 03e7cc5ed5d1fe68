/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Health of one source as seen by the supervisor. Only the supervisor's reconciliation loop creates these.
 *
 * @param degraded true while the publisher holds events of this source past the staleness bound
 */
public record WorkerState(String sourceId,
                          WorkerStatus status,
                          String lastError,
                          int restartCount,
                          Instant lastHeartbeat,
                          boolean degraded) {

    public WorkerState {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(status, "status");
    }

    public static WorkerState initial(String sourceId) {
        return new WorkerState(sourceId, WorkerStatus.STARTING, null, 0, null, false);
    }

    public WorkerState withStatus(WorkerStatus value) {
        return new WorkerState(sourceId, value, lastError, restartCount, lastHeartbeat, degraded);
    }

    public WorkerState withError(WorkerStatus value, String error) {
        return new WorkerState(sourceId, value, error, restartCount, lastHeartbeat, degraded);
    }

    public WorkerState withRestart() {
        return new WorkerState(sourceId, status, lastError, restartCount + 1, lastHeartbeat, degraded);
    }

    public WorkerState withHeartbeat(Instant at) {
        return new WorkerState(sourceId, status, lastError, restartCount, at, degraded);
    }

    public WorkerState withDegraded(boolean value) {
        return new WorkerState(sourceId, status, lastError, restartCount, lastHeartbeat, value);
    }

    public WorkerState resetRestarts() {
        return new WorkerState(sourceId, status, lastError, 0, lastHeartbeat, degraded);
    }
}
