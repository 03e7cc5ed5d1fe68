/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.redis;

import com.intuitivedesigns.chainkernel.error.CacheException;
import com.intuitivedesigns.chainkernel.metrics.KernelMetrics;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.model.ChainPosition;
import com.intuitivedesigns.chainkernel.model.Checkpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Redis down: dedup degrades to miss / no-op, checkpoints surface CacheException.
 */
class RedisUnavailableTest {

    private final List<String> counters = new CopyOnWriteArrayList<>();
    private final MetricsRuntime metrics = new MetricsRuntime() {
        @Override
        public Object registry() {
            return null;
        }

        @Override
        public void counter(String name) {
            counters.add(name);
        }
    };

    private JedisPool pool;

    @BeforeEach
    void pointAtClosedPort() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        JedisPoolConfig config = new JedisPoolConfig();
        config.setMaxWait(Duration.ofMillis(200));
        pool = new JedisPool(config, "127.0.0.1", port, 200);
    }

    @AfterEach
    void closePool() {
        pool.close();
    }

    @Test
    void testDedupDegradesToMiss() {
        RedisDedupCache cache = new RedisDedupCache(pool, metrics);

        assertFalse(cache.seen("eth-1:1:0"));
        assertDoesNotThrow(() -> cache.mark("eth-1:1:0", Duration.ofHours(24)));

        assertEquals(2, cache.errorCount());
        assertEquals(2, counters.stream().filter(KernelMetrics.CACHE_ERRORS::equals).count());
        assertThrows(CacheException.class, cache::verify);
    }

    @Test
    void testCheckpointFailuresSurface() {
        RedisCheckpointStore store = new RedisCheckpointStore(pool);

        assertThrows(CacheException.class, () -> store.load("eth-1"));
        assertThrows(CacheException.class,
                () -> store.save(new Checkpoint("eth-1", ChainPosition.of(10, 2), Instant.EPOCH)));
        assertThrows(CacheException.class, () -> store.delete("eth-1"));
        assertThrows(CacheException.class, store::verify);
    }
}
