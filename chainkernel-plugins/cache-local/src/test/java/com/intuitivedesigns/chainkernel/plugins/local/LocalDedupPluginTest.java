/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.local;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class LocalDedupPluginTest {

    private final AtomicLong nanos = new AtomicLong();
    private final LocalDedupPlugin.LocalDedupCache cache = new LocalDedupPlugin.LocalDedupCache(100, nanos::get);

    @Test
    void testMarkedKeyIsSeenUntilTtl() {
        assertFalse(cache.seen("eth-1:1:0"));

        cache.mark("eth-1:1:0", Duration.ofSeconds(10));
        assertTrue(cache.seen("eth-1:1:0"));
        assertFalse(cache.seen("eth-1:1:1"));

        nanos.addAndGet(Duration.ofSeconds(9).toNanos());
        assertTrue(cache.seen("eth-1:1:0"));

        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        assertFalse(cache.seen("eth-1:1:0"));
    }

    @Test
    void testTtlIsPerEntry() {
        cache.mark("short", Duration.ofSeconds(1));
        cache.mark("long", Duration.ofHours(24));

        nanos.addAndGet(Duration.ofMinutes(1).toNanos());

        assertFalse(cache.seen("short"));
        assertTrue(cache.seen("long"));
    }

    @Test
    void testNonPositiveTtlIsIgnored() {
        cache.mark("k", Duration.ZERO);
        assertFalse(cache.seen("k"));
        assertFalse(cache.seen(null));
    }

    @Test
    void testPluginCreatesWorkingCache() {
        DedupCache created = new LocalDedupPlugin().create(KernelConfig.of(Map.of("dedup.local.max.size", "10")), () -> null);

        created.mark("a", Duration.ofMinutes(5));
        assertTrue(created.seen("a"));
        created.close();
        assertFalse(created.seen("a"));
        assertEquals("LOCAL", new LocalDedupPlugin().id());
    }
}
