/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.redis;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RedisPoolsTest {

    @Test
    void testDefaults() {
        RedisPools.Endpoint e = RedisPools.Endpoint.resolve(KernelConfig.of(Map.of()), "dedup");

        assertEquals("localhost", e.host);
        assertEquals(6379, e.port);
        assertNull(e.password);
        assertEquals(0, e.database);
        assertFalse(e.tls);
        assertEquals(64, e.maxTotal);
    }

    @Test
    void testRoleSettingsOverrideShared() {
        KernelConfig config = KernelConfig.of(Map.of(
                "redis.host", "shared",
                "redis.password", "s3cret",
                "redis.checkpoint.host", "cp-host",
                "redis.checkpoint.database", "3",
                "redis.checkpoint.tls", "true"));

        RedisPools.Endpoint checkpoint = RedisPools.Endpoint.resolve(config, "checkpoint");
        RedisPools.Endpoint dedup = RedisPools.Endpoint.resolve(config, "dedup");

        assertEquals("cp-host", checkpoint.host);
        assertEquals(3, checkpoint.database);
        assertTrue(checkpoint.tls);
        assertEquals("s3cret", checkpoint.password);

        assertEquals("shared", dedup.host);
        assertEquals(0, dedup.database);
        assertFalse(dedup.tls);
    }

    @Test
    void testOutOfRangeValuesAreClamped() {
        KernelConfig config = KernelConfig.of(Map.of(
                "redis.port", "70000",
                "redis.timeout.ms", "5",
                "redis.pool.max", "0"));

        RedisPools.Endpoint e = RedisPools.Endpoint.resolve(config, "dedup");

        assertEquals(65_535, e.port);
        assertEquals(100, e.timeoutMs);
        assertEquals(1, e.maxTotal);
    }
}
