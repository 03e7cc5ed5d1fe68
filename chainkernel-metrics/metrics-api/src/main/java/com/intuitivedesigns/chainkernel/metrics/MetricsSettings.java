/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.spi.PluginIds;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Metrics bootstrap settings.
 *
 * <ul>
 *   <li>{@code metrics.provider}: NOOP | PROMETHEUS (default NONE, which falls back to NOOP)</li>
 *   <li>{@code metrics.tag.<name>=<value>}: common tags on every meter, e.g. {@code metrics.tag.region=eu-1}</li>
 *   <li>{@code metrics.prometheus.port} / {@code metrics.prometheus.path}: scrape endpoint (9090, /metrics)</li>
 * </ul>
 */
public record MetricsSettings(String providerId,
                              Map<String, String> commonTags,
                              int prometheusPort,
                              String prometheusPath) {

    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";
    private static final String KEY_PROM_PATH = "metrics.prometheus.path";

    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_PROM_PORT = 9090;
    private static final String DEFAULT_PROM_PATH = "/metrics";

    public MetricsSettings {
        Objects.requireNonNull(providerId, "providerId");
        commonTags = Map.copyOf(commonTags);
    }

    public static MetricsSettings from(KernelConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = PluginIds.normalize(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        // Sorted so the tag set is stable across restarts
        final Map<String, String> tags = new TreeMap<>();
        for (String k : config.keys()) {
            if (!k.startsWith(KEY_TAG_PREFIX)) continue;
            final String name = trimToNull(k.substring(KEY_TAG_PREFIX.length()));
            final String value = trimToNull(config.getString(k, null));
            if (name != null && value != null) {
                tags.put(name, value);
            }
        }

        final int port = Math.max(0, Math.min(65_535, config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT)));
        String path = trimToNull(config.getString(KEY_PROM_PATH, DEFAULT_PROM_PATH));
        if (path == null || !path.startsWith("/")) {
            path = DEFAULT_PROM_PATH;
        }

        return new MetricsSettings(provider.isEmpty() ? DEFAULT_PROVIDER : provider, tags, port, path);
    }

    /**
     * The common tags as Micrometer {@link Tags}.
     */
    public Tags tags() {
        final List<Tag> out = new ArrayList<>(commonTags.size());
        commonTags.forEach((k, v) -> out.add(Tag.of(k, v)));
        return Tags.of(out);
    }

    public boolean selects(String id) {
        return PluginIds.sameId(providerId, id);
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        final String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
