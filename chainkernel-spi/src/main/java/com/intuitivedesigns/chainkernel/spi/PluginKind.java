/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

/**
 * The collaborator kinds a plugin can contribute. Each selectable kind names the bootstrap key that picks
 * exactly one plugin; chain plugins have no key because every chain type on the classpath is registered.
 */
public enum PluginKind {
    REGISTRY("registry.type", "Registry"),
    BUS("bus.type", "Event Bus"),
    DEDUP("dedup.type", "Dedup Cache"),
    CHECKPOINT("checkpoint.type", "Checkpoint Store"),
    CONNECTION("connection.type", "Connection Factory"),
    CHAIN(null, "Chain Support");

    private final String configKey;
    private final String label;

    PluginKind(String configKey, String label) {
        this.configKey = configKey;
        this.label = label;
    }

    /**
     * @return the selection key, or null for {@link #CHAIN}
     */
    public String configKey() {
        return configKey;
    }

    public String label() {
        return label;
    }

    public boolean selectable() {
        return configKey != null;
    }
}
