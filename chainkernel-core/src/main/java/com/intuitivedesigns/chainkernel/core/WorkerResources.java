/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;

import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators shared by every {@link SourceWorker}. All of them are safe for concurrent use.
 */
public record WorkerResources(DecoderRegistry decoders,
                              ConnectionFactory connections,
                              DedupCache dedup,
                              DedupMarker dedupMarks,
                              CheckpointStore checkpoints,
                              Publisher publisher,
                              WorkerSettings settings,
                              MetricsRuntime metrics,
                              Clock clock) {

    public WorkerResources {
        Objects.requireNonNull(decoders, "decoders");
        Objects.requireNonNull(connections, "connections");
        Objects.requireNonNull(dedup, "dedup");
        Objects.requireNonNull(dedupMarks, "dedupMarks");
        Objects.requireNonNull(checkpoints, "checkpoints");
        Objects.requireNonNull(publisher, "publisher");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(clock, "clock");
    }
}
