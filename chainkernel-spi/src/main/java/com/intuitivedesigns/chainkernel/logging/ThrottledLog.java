/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.logging;

import org.slf4j.Logger;
import org.slf4j.event.Level;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * Emits at most one line per interval for a repeating failure and folds the rest into a
 * "suppressed N" count on the next line that gets through.
 *
 * <p>Safe to share across threads. One instance per failure family (a source, a bus, a cache).</p>
 */
public final class ThrottledLog {

    private final Logger logger;
    private final Level level;
    private final long intervalMs;
    private final LongSupplier clockMs;

    private final AtomicLong lastEmitMs;
    private final LongAdder suppressed = new LongAdder();
    private final LongAdder emitted = new LongAdder();

    public ThrottledLog(Logger logger, Level level, long intervalMs) {
        this(logger, level, intervalMs, System::currentTimeMillis);
    }

    ThrottledLog(Logger logger, Level level, long intervalMs, LongSupplier clockMs) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNull(level, "level");
        this.intervalMs = Math.max(100L, intervalMs);
        this.clockMs = Objects.requireNonNull(clockMs, "clockMs");
        this.lastEmitMs = new AtomicLong(Long.MIN_VALUE / 2);
    }

    public static ThrottledLog warn(Logger logger, long intervalMs) {
        return new ThrottledLog(logger, Level.WARN, intervalMs);
    }

    public static ThrottledLog error(Logger logger, long intervalMs) {
        return new ThrottledLog(logger, Level.ERROR, intervalMs);
    }

    /**
     * @return true when the line was written, false when it was counted as suppressed
     */
    public boolean report(String context, Throwable cause) {
        final long now = clockMs.getAsLong();
        final long last = lastEmitMs.get();
        if (now - last < intervalMs || !lastEmitMs.compareAndSet(last, now)) {
            suppressed.increment();
            return false;
        }

        final String reason = (cause == null || cause.getMessage() == null)
                ? (cause == null ? "unknown" : cause.getClass().getSimpleName())
                : cause.getMessage();
        final long folded = suppressed.sumThenReset();
        if (folded > 0) {
            logger.atLevel(level).log("{} (suppressed {} similar): {}", context, folded, reason);
        } else {
            logger.atLevel(level).log("{}: {}", context, reason);
        }
        emitted.increment();
        return true;
    }

    public long emittedCount() {
        return emitted.sum();
    }

    public long pendingSuppressed() {
        return suppressed.sum();
    }
}
