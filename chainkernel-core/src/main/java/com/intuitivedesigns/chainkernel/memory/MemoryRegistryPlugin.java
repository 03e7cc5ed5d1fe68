/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ConfigStore;
import com.intuitivedesigns.chainkernel.error.ConfigException;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.RegistryPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * In-process registry, optionally seeded from a JSON array of source definitions.
 * <p>
 * ID: MEMORY
 */
public final class MemoryRegistryPlugin implements RegistryPlugin {

    public static final String ID = "MEMORY";
    private static final Logger log = LoggerFactory.getLogger(MemoryRegistryPlugin.class);

    private static final String CFG_SEED_FILE = "registry.memory.file";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ConfigStore create(KernelConfig config, MetricsRuntime metrics) throws Exception {
        final InMemoryConfigStore store = new InMemoryConfigStore();
        final String seed = config.getString(CFG_SEED_FILE, "").trim();
        if (seed.isEmpty()) {
            log.info("Creating in-memory registry (empty)");
            return store;
        }

        final JsonNode root = MAPPER.readTree(Files.readString(Path.of(seed)));
        if (!root.isArray()) {
            throw new ConfigException(null, CFG_SEED_FILE + " must contain a JSON array: " + seed);
        }
        int count = 0;
        for (JsonNode entry : root) {
            final String id = entry.path("id").asText("").trim();
            if (id.isEmpty()) {
                log.warn("Skipping seed entry without id: {}", entry);
                continue;
            }
            store.putRaw(id, MAPPER.writeValueAsString(entry));
            count++;
        }
        log.info("Creating in-memory registry seeded with {} source(s) from {}", count, seed);
        return store;
    }
}
