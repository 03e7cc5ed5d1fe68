/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter, capped at a maximum.
 * Delay for attempt n (1-based) is {@code initial * 2^(n-1)}, jittered, never above {@code max}.
 */
public final class BackoffPolicy {

    private final long initialMs;
    private final long maxMs;
    private final double jitterFactor;

    public BackoffPolicy(Duration initial, Duration max, double jitterFactor) {
        this.initialMs = Math.max(1L, initial.toMillis());
        this.maxMs = Math.max(this.initialMs, max.toMillis());
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
    }

    /**
     * Default: 500ms initial, 30s cap, +/-20% jitter.
     */
    public static BackoffPolicy defaultPolicy() {
        return new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(30), 0.2);
    }

    public Duration delay(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 20));
        long exponential = Math.min(maxMs, initialMs * (1L << exponent));
        return Duration.ofMillis(Math.min(maxMs, jitter(exponential)));
    }

    public Duration max() {
        return Duration.ofMillis(maxMs);
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) return value;
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double factor = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }
}
