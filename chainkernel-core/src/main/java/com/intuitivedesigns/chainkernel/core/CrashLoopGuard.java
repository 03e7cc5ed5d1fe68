/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling restart counter for one source. Not thread-safe; owned by the supervisor loop.
 */
final class CrashLoopGuard {

    private final int maxRestarts;
    private final Duration window;
    private final Deque<Instant> restarts = new ArrayDeque<>();

    CrashLoopGuard(int maxRestarts, Duration window) {
        this.maxRestarts = maxRestarts;
        this.window = window;
    }

    /**
     * Records one restart.
     *
     * @return true if the restarts inside the window now exceed the maximum
     */
    boolean record(Instant now) {
        restarts.addLast(now);
        prune(now);
        return restarts.size() > maxRestarts;
    }

    int recent(Instant now) {
        prune(now);
        return restarts.size();
    }

    void reset() {
        restarts.clear();
    }

    private void prune(Instant now) {
        final Instant cutoff = now.minus(window);
        while (!restarts.isEmpty() && restarts.peekFirst().isBefore(cutoff)) {
            restarts.pollFirst();
        }
    }
}
