/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServicePluginRegistryTest {

    private static DedupPlugin plugin(String id) {
        return new DedupPlugin() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public DedupCache create(KernelConfig config, MetricsRuntime metrics) {
                return new DedupCache() {
                    @Override
                    public boolean seen(String dedupKey) {
                        return false;
                    }

                    @Override
                    public void mark(String dedupKey, Duration ttl) {
                    }
                };
            }
        };
    }

    @Test
    void testLookupIsCaseInsensitive() {
        ServicePluginRegistry<DedupPlugin> registry =
                new ServicePluginRegistry<>(PluginKind.DEDUP, List.of(plugin("local"), plugin("Redis")));

        assertEquals(List.of("LOCAL", "REDIS"), List.copyOf(registry.availableIds()));
        assertEquals("local", registry.require(" Local ").id());
        assertTrue(registry.get("redis").isPresent());
        assertEquals(PluginKind.DEDUP, registry.require("REDIS").kind());
    }

    @Test
    void testMissingPluginNamesKeyAndOptions() {
        ServicePluginRegistry<DedupPlugin> registry =
                new ServicePluginRegistry<>(PluginKind.DEDUP, List.of(plugin("LOCAL")));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> registry.require("MEMCACHED"));
        assertTrue(ex.getMessage().contains("dedup.type=MEMCACHED"));
        assertTrue(ex.getMessage().contains("LOCAL"));
    }

    @Test
    void testDuplicateIdsRejected() {
        assertThrows(IllegalStateException.class,
                () -> new ServicePluginRegistry<>(PluginKind.DEDUP, List.of(plugin("LOCAL"), plugin("local"))));
    }

    @Test
    void testBlankIdRejected() {
        assertThrows(IllegalStateException.class,
                () -> new ServicePluginRegistry<>(PluginKind.DEDUP, List.of(plugin(" "))));
    }

    @Test
    void testPluginOfAnotherKindRejected() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new ServicePluginRegistry<DedupPlugin>(PluginKind.CHECKPOINT, List.of(plugin("LOCAL"))));
        assertTrue(ex.getMessage().contains("DEDUP"));
    }

    @Test
    void testIdHelpers() {
        assertEquals("EVM", PluginIds.normalize(" evm "));
        assertEquals("evm", PluginIds.chainType(" EVM "));
        assertTrue(PluginIds.sameId("prometheus", " PROMETHEUS"));
        assertFalse(PluginIds.sameId(" ", ""));
    }
}
