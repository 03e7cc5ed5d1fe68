/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable cursor: the last position of a source whose events are known to be on the bus.
 */
public record Checkpoint(String sourceId, ChainPosition position, Instant updatedAt) {

    public Checkpoint {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
