/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;

/**
 * Bootstrap configuration.
 *
 * <p>Loads once from the file named by {@code -Dck.config.path} or {@code CK_CONFIG_PATH}, then applies
 * environment overrides: {@code CK_KAFKA_BROKER} sets {@code kafka.broker} ({@code CK_} stripped,
 * lower-cased, {@code _} to {@code .}). Never hot-reloaded.</p>
 */
public final class KernelConfig {

    private static final Logger log = LoggerFactory.getLogger(KernelConfig.class);

    public static final String PROP_CONFIG_PATH = "ck.config.path";
    public static final String ENV_CONFIG_PATH = "CK_CONFIG_PATH";
    public static final String ENV_PREFIX = "CK_";

    private static volatile KernelConfig instance;

    private final Properties props;

    private KernelConfig(Properties props) {
        this.props = props;
    }

    public static KernelConfig get() {
        KernelConfig local = instance;
        if (local == null) {
            synchronized (KernelConfig.class) {
                local = instance;
                if (local == null) {
                    local = new KernelConfig(withEnvironment(load(), System.getenv()));
                    instance = local;
                }
            }
        }
        return local;
    }

    /**
     * Wraps an explicit property set (tests, embedded use). The properties are copied.
     */
    public static KernelConfig of(Properties source) {
        return new KernelConfig(withEnvironment(source, Map.of()));
    }

    public static KernelConfig of(Map<String, String> source) {
        final Properties copy = new Properties();
        if (source != null) {
            copy.putAll(source);
        }
        return new KernelConfig(copy);
    }

    /**
     * Copies {@code base} and lays {@code CK_*} variables from {@code env} over it.
     */
    static Properties withEnvironment(Properties base, Map<String, String> env) {
        final Properties merged = new Properties();
        if (base != null) {
            merged.putAll(base);
        }
        int applied = 0;
        for (Map.Entry<String, String> e : env.entrySet()) {
            final String name = e.getKey();
            if (!name.startsWith(ENV_PREFIX) || name.equals(ENV_CONFIG_PATH) || name.length() == ENV_PREFIX.length()) {
                continue;
            }
            merged.setProperty(envToKey(name), e.getValue());
            applied++;
        }
        if (applied > 0) {
            log.info("Applied {} {}* environment override(s).", applied, ENV_PREFIX);
        }
        return merged;
    }

    static String envToKey(String envName) {
        return envName.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '.');
    }

    private static Properties load() {
        String path = System.getProperty(PROP_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        final Properties props = new Properties();
        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/chainkernel.properties", PROP_CONFIG_PATH);
            return props;
        }

        try (InputStream in = Files.newInputStream(Path.of(path))) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties from {}", props.size(), path);
        return props;
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::valueOf, "int");
    }

    public long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::valueOf, "long");
    }

    public double getDouble(String key, double defaultValue) {
        return parse(key, defaultValue, Double::valueOf, "double");
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        final String raw = props.getProperty(key);
        return raw == null ? defaultValue : Boolean.parseBoolean(raw.trim());
    }

    /** Millisecond-valued key as a Duration. */
    public Duration getMillis(String key, long defaultMillis) {
        return Duration.ofMillis(Math.max(0L, getLong(key, defaultMillis)));
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        final Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }

    private <T> T parse(String key, T defaultValue, Function<String, T> parser, String type) {
        final String raw = props.getProperty(key);
        if (raw == null) return defaultValue;
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} for '{}': '{}' (using {})", type, key, raw, defaultValue);
            return defaultValue;
        }
    }
}
