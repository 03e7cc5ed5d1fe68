/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Plugins of one {@link PluginKind}, indexed by normalized id.
 *
 * <p>The classpath is scanned once, at construction. A plugin whose {@code kind()} disagrees with the
 * registry's kind, a blank id, or two plugins sharing an id all fail construction, so a broken plugin
 * jar surfaces at boot rather than at first lookup.</p>
 *
 * @param <T> the plugin interface (e.g. {@link BusPlugin})
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private final PluginKind kind;
    private final Map<String, T> byId;
    private final SortedSet<String> ids;

    public static <T extends PipelinePlugin<?>> ServicePluginRegistry<T> load(PluginKind kind,
                                                                                Class<T> spiType,
                                                                                ClassLoader cl) {
        return new ServicePluginRegistry<>(kind, ServiceLoader.load(spiType, cl));
    }

    public ServicePluginRegistry(PluginKind kind, Iterable<? extends T> plugins) {
        this.kind = kind;
        final Map<String, T> tmp = new LinkedHashMap<>();
        for (T plugin : plugins) {
            if (plugin.kind() != kind) {
                throw new IllegalStateException(plugin.getClass().getName() + " declares kind " + plugin.kind()
                        + " but is registered as a " + kind.label() + " plugin");
            }
            final String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Blank plugin id for " + plugin.getClass().getName());
            }
            final T previous = tmp.putIfAbsent(id, plugin);
            if (previous != null) {
                throw new IllegalStateException("Duplicate " + kind.label() + " plugin '" + id + "': "
                        + previous.getClass().getName() + " and " + plugin.getClass().getName());
            }
        }
        this.byId = Collections.unmodifiableMap(tmp);
        this.ids = Collections.unmodifiableSortedSet(new TreeSet<>(tmp.keySet()));
    }

    public PluginKind kind() {
        return kind;
    }

    /**
     * @throws IllegalArgumentException naming the selection key and the ids that are available
     */
    public T require(String id) {
        final T plugin = byId.get(PluginIds.normalize(id));
        if (plugin == null) {
            final String key = kind.selectable() ? kind.configKey() : kind.name().toLowerCase(Locale.ROOT);
            throw new IllegalArgumentException("No " + kind.label() + " plugin for '" + key + "=" + id
                    + "'. Available: " + ids);
        }
        return plugin;
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }

    public SortedSet<String> availableIds() {
        return ids;
    }

    public Collection<T> all() {
        return byId.values();
    }
}
