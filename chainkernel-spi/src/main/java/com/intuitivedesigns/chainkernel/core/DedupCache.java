/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import java.time.Duration;

/**
 * Best-effort suppression of re-emitted records. Not a correctness mechanism.
 * Implementations never throw: unavailability reads as "not seen" and marks become no-ops.
 * Shared by all workers, so implementations must be thread-safe.
 */
public interface DedupCache extends AutoCloseable {

    boolean seen(String dedupKey);

    void mark(String dedupKey, Duration ttl);

    /**
     * Bootstrap reachability check.
     */
    default void verify() throws Exception {}

    @Override
    default void close() {}
}
