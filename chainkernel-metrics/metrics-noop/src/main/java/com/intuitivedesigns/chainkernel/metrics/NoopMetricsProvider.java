/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

/**
 * {@code metrics.provider=NOOP}: metrics explicitly off.
 */
public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        return MetricsRuntime.noop();
    }
}
