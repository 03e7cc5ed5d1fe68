/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.app;

import com.intuitivedesigns.chainkernel.core.Publisher;
import com.intuitivedesigns.chainkernel.model.WorkerState;
import com.intuitivedesigns.chainkernel.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Periodic one-line kernel status: publish rate, buffer depth and sources per status.
 */
final class StatusReporter implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StatusReporter.class);

    private final Supplier<Map<String, WorkerState>> snapshot;
    private final Publisher publisher;
    private final int windowSeconds;

    private long lastTimeNs = System.nanoTime();
    private long lastPublished = 0;

    StatusReporter(Supplier<Map<String, WorkerState>> snapshot, Publisher publisher, int windowSeconds) {
        this.snapshot = snapshot;
        this.publisher = publisher;
        this.windowSeconds = windowSeconds;
    }

    @Override
    public void run() {
        try {
            final long nowNs = System.nanoTime();
            final long elapsedNs = nowNs - lastTimeNs;
            if (elapsedNs <= 0) {
                return;
            }

            final long publishedNow = publisher.publishedTotal();
            final double eps = (publishedNow - lastPublished) / (elapsedNs / 1_000_000_000.0);

            log.info(format(windowSeconds, eps, publisher.buffered(), publisher.retriesTotal(), snapshot.get()));

            lastPublished = publishedNow;
            lastTimeNs = nowNs;
        } catch (Throwable t) {
            log.warn("Status reporter error", t);
        }
    }

    static String format(int windowSeconds, double eps, int buffered, long retries, Map<String, WorkerState> states) {
        final Map<WorkerStatus, Integer> counts = new EnumMap<>(WorkerStatus.class);
        int degraded = 0;
        for (WorkerState s : states.values()) {
            counts.merge(s.status(), 1, Integer::sum);
            if (s.degraded()) degraded++;
        }

        final StringBuilder sb = new StringBuilder(String.format(Locale.US,
                "AVG %ds | PUBLISHED: %,.0f eps | BUFFERED: %,d | RETRIES: %,d | SOURCES: %d",
                windowSeconds, eps, buffered, retries, states.size()));
        for (WorkerStatus status : WorkerStatus.values()) {
            final Integer n = counts.get(status);
            if (n != null) {
                sb.append(' ').append(status.label()).append('=').append(n);
            }
        }
        if (degraded > 0) {
            sb.append(" | DEGRADED: ").append(degraded);
        }
        return sb.toString();
    }
}
