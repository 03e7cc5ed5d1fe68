/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

/**
 * Metrics facade handed to every plugin and kernel component.
 *
 * <p>All recording methods default to no-ops. Names come from {@link KernelMetrics}; tags are passed as
 * alternating key/value strings, e.g. {@code taggedCounter(DECODE_FAILURES, "source", "chainA-main")}.
 * Components that need Micrometer directly check {@code registry() instanceof MeterRegistry}.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * @return the backing registry, or a sentinel object when nothing is recorded; never null
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void taggedCounter(String name, String... tagPairs) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    /**
     * Sets a gauge that exists once per tag combination, e.g. workers per status.
     */
    default void taggedGauge(String name, double value, String... tagPairs) {}

    @Override
    default void close() {}

    /**
     * The shared runtime that records nothing.
     */
    static MetricsRuntime noop() {
        return NoopMetricsRuntime.INSTANCE;
    }
}
