/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.memory;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ConfigStore;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.core.EventBus;
import com.intuitivedesigns.chainkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.chainkernel.model.ChainPosition;
import com.intuitivedesigns.chainkernel.model.DeliveryReceipt;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RegistrySnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryPluginsTest {

    private final MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();

    @Test
    void testRegistrySeededFromFile(@TempDir Path dir) throws Exception {
        Path seed = dir.resolve("sources.json");
        Files.writeString(seed, "["
                + "{\"id\":\"chainA-main\",\"chain_type\":\"evm\",\"endpoint\":\"wss://node.example\",\"enabled\":true},"
                + "{\"id\":\"bad\",\"chain_type\":\"evm\"},"
                + "{\"chain_type\":\"evm\"}"
                + "]");

        ConfigStore store = new MemoryRegistryPlugin().create(
                KernelConfig.of(Map.of("registry.memory.file", seed.toString())), metrics);
        RegistrySnapshot snap = store.list();

        assertEquals(1, snap.configs().size());
        assertEquals("wss://node.example", snap.configs().get(0).endpoint());
        assertEquals(1, snap.invalid().size());
    }

    @Test
    void testRegistryWithoutSeedIsEmpty() throws Exception {
        ConfigStore store = new MemoryRegistryPlugin().create(KernelConfig.of(Map.of()), metrics);
        assertTrue(store.list().configs().isEmpty());
    }

    @Test
    void testNoopDedupNeverSeesAnything() {
        DedupCache dedup = new NoopDedupPlugin().create(KernelConfig.of(Map.of()), metrics);
        dedup.mark("k", Duration.ofMinutes(1));
        assertFalse(dedup.seen("k"));
    }

    @Test
    void testLogBusAcknowledgesImmediately() throws Exception {
        EventBus bus = new LogBusPlugin().create(KernelConfig.of(Map.of("bus.log.level", "debug")), metrics);
        NormalizedEvent event = new NormalizedEvent("s", "evm", ChainPosition.of(1, 0), "block",
                Map.of("hash", "0xabc"), "s:1:0", Instant.EPOCH);

        DeliveryReceipt first = bus.send(event).get();
        DeliveryReceipt second = bus.send(event).get();

        assertEquals("s:1:0", first.dedupKey());
        assertEquals(0, first.offset());
        assertEquals(1, second.offset());
        bus.close();
    }
}
