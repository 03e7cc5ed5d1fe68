/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

/**
 * A metrics backend, discovered through {@code META-INF/services/com.intuitivedesigns.chainkernel.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * @return the {@code metrics.provider} value that selects this backend
     */
    String id();

    /**
     * Builds the runtime. Only called when {@link MetricsSettings#selects(String)} matched {@link #id()}.
     */
    MetricsRuntime create(MetricsSettings settings);
}
