/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.config;

import com.intuitivedesigns.chainkernel.core.ChainSupport;
import com.intuitivedesigns.chainkernel.core.CheckpointStore;
import com.intuitivedesigns.chainkernel.core.ConfigStore;
import com.intuitivedesigns.chainkernel.core.ConnectionFactory;
import com.intuitivedesigns.chainkernel.core.DecoderRegistry;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.core.EventBus;
import com.intuitivedesigns.chainkernel.error.BootstrapException;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wires the configured plugins into the kernel's collaborators.
 * The {@code verify*} methods are the bootstrap reachability checks; each failure is fatal.
 */
public final class KernelFactory {

    private static final Logger log = LoggerFactory.getLogger(KernelFactory.class);

    // Defaults; the registry has none and must be named explicitly
    private static final String DEFAULT_BUS = "KAFKA";
    private static final String DEFAULT_DEDUP = "REDIS";
    private static final String DEFAULT_CHECKPOINT = "REDIS";
    private static final String DEFAULT_CONNECTION = "JSONRPC";

    private static final PluginCatalog CATALOG = new PluginCatalog(resolveClassLoader());

    private KernelFactory() {}

    // --- FACTORY METHODS ---

    public static ConfigStore createRegistry(KernelConfig config, MetricsRuntime metrics) {
        return create(CATALOG.registries(), config, metrics, null);
    }

    public static EventBus createBus(KernelConfig config, MetricsRuntime metrics) {
        return create(CATALOG.buses(), config, metrics, DEFAULT_BUS);
    }

    public static DedupCache createDedup(KernelConfig config, MetricsRuntime metrics) {
        return create(CATALOG.dedupCaches(), config, metrics, DEFAULT_DEDUP);
    }

    public static CheckpointStore createCheckpoints(KernelConfig config, MetricsRuntime metrics) {
        return create(CATALOG.checkpointStores(), config, metrics, DEFAULT_CHECKPOINT);
    }

    public static ConnectionFactory createConnections(KernelConfig config, MetricsRuntime metrics) {
        return create(CATALOG.connections(), config, metrics, DEFAULT_CONNECTION);
    }

    /**
     * Builds the decoder registry from every chain plugin on the classpath. Called once at bootstrap;
     * the result never changes afterwards.
     */
    public static DecoderRegistry createDecoders(KernelConfig config, MetricsRuntime metrics) {
        return createDecoders(CATALOG.chains().all(), config, metrics);
    }

    static DecoderRegistry createDecoders(Iterable<? extends ChainPlugin> plugins, KernelConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final DecoderRegistry.Builder builder = DecoderRegistry.builder();
        for (ChainPlugin plugin : plugins) {
            final ChainSupport support = createSafe(plugin, config, metrics);
            builder.register(support);
        }
        final DecoderRegistry registry = builder.build();
        if (registry.chainTypes().isEmpty()) {
            log.warn("No chain plugins found: every source will fail with an unknown decoder");
        }
        return registry;
    }

    // --- BOOTSTRAP CHECKS ---

    public static void verifyRegistry(ConfigStore store) {
        try {
            store.verify();
        } catch (Exception e) {
            throw new BootstrapException("Registry unreachable", e);
        }
    }

    public static void verifyBus(EventBus bus) {
        try {
            bus.verify();
        } catch (Exception e) {
            throw new BootstrapException("Event bus unreachable", e);
        }
    }

    public static void verifyCaches(DedupCache dedup, CheckpointStore checkpoints) {
        try {
            dedup.verify();
            checkpoints.verify();
        } catch (Exception e) {
            throw new BootstrapException("Cache unreachable", e);
        }
    }

    // --- UTILITIES ---

    public static void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        for (ServicePluginRegistry<?> plugins : CATALOG.all()) {
            log.info("  {}: {}", plugins.kind().label(), plugins.availableIds());
        }
    }

    /**
     * Selects the plugin named by the kind's config key. A null default makes the key mandatory.
     */
    private static <T, P extends PipelinePlugin<T>> T create(ServicePluginRegistry<P> plugins,
                                                             KernelConfig config,
                                                             MetricsRuntime metrics,
                                                             String defaultId) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String key = plugins.kind().configKey();
        final String id = (defaultId == null)
                ? require(config, key)
                : normalizeId(config.getString(key, defaultId), defaultId);
        return createSafe(plugins.require(id), config, metrics);
    }

    private static String require(KernelConfig config, String key) {
        final String v = config.getString(key, null);
        if (v == null) {
            throw new IllegalArgumentException("Missing required configuration key: " + key);
        }
        final String s = v.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Blank value for required configuration key: " + key);
        }
        return s;
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : KernelFactory.class.getClassLoader();
    }

    private static <T> T createSafe(PipelinePlugin<T> plugin, KernelConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(plugin, "plugin");
        final String typeName = plugin.kind().label();
        try {
            return plugin.create(config, metrics);
        } catch (Throwable t) {
            final String pluginId;
            try {
                pluginId = String.valueOf(plugin.id());
            } catch (Throwable ignored) {
                throw new BootstrapException("Failed creating " + typeName + " (plugin id unavailable)", t);
            }
            throw new BootstrapException("Failed creating " + typeName + " [" + pluginId + "]", t);
        }
    }
}
