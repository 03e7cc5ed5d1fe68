/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Picks the metrics backend named by {@code metrics.provider}. Falls back to {@link MetricsRuntime#noop()}
 * when nothing matches or the selected backend fails to start.
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        for (MetricsProvider p : ServiceLoader.load(MetricsProvider.class, resolveClassLoader())) {
            if (!settings.selects(p.id())) {
                continue;
            }
            try {
                final MetricsRuntime rt = p.create(settings);
                log.info("Metrics Runtime initialized: {} ({})", p.id(), p.getClass().getName());
                return rt;
            } catch (Throwable t) {
                // NoClassDefFoundError when the backend jar is missing
                log.warn("Failed to initialize metrics provider [{}]: {}", p.id(), t.getMessage());
                log.debug("Provider init stack trace:", t);
                break;
            }
        }

        log.info("Metrics disabled or no suitable provider found for '{}' (NOOP active).", settings.providerId());
        return MetricsRuntime.noop();
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
