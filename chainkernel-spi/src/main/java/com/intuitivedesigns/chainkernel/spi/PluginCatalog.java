/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import java.util.List;

/**
 * Every plugin visible to one class loader, grouped by kind.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<RegistryPlugin> registries;
    private final ServicePluginRegistry<BusPlugin> buses;
    private final ServicePluginRegistry<DedupPlugin> dedupCaches;
    private final ServicePluginRegistry<CheckpointPlugin> checkpointStores;
    private final ServicePluginRegistry<ConnectionPlugin> connections;
    private final ServicePluginRegistry<ChainPlugin> chains;

    public PluginCatalog(ClassLoader cl) {
        this.registries = ServicePluginRegistry.load(PluginKind.REGISTRY, RegistryPlugin.class, cl);
        this.buses = ServicePluginRegistry.load(PluginKind.BUS, BusPlugin.class, cl);
        this.dedupCaches = ServicePluginRegistry.load(PluginKind.DEDUP, DedupPlugin.class, cl);
        this.checkpointStores = ServicePluginRegistry.load(PluginKind.CHECKPOINT, CheckpointPlugin.class, cl);
        this.connections = ServicePluginRegistry.load(PluginKind.CONNECTION, ConnectionPlugin.class, cl);
        this.chains = ServicePluginRegistry.load(PluginKind.CHAIN, ChainPlugin.class, cl);
    }

    public ServicePluginRegistry<RegistryPlugin> registries() {
        return registries;
    }

    public ServicePluginRegistry<BusPlugin> buses() {
        return buses;
    }

    public ServicePluginRegistry<DedupPlugin> dedupCaches() {
        return dedupCaches;
    }

    public ServicePluginRegistry<CheckpointPlugin> checkpointStores() {
        return checkpointStores;
    }

    public ServicePluginRegistry<ConnectionPlugin> connections() {
        return connections;
    }

    public ServicePluginRegistry<ChainPlugin> chains() {
        return chains;
    }

    /**
     * In {@link PluginKind} order.
     */
    public List<ServicePluginRegistry<?>> all() {
        return List.of(registries, buses, dedupCaches, checkpointStores, connections, chains);
    }
}
