/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.redis;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Protocol;

/**
 * Builds the {@link JedisPool} behind the dedup cache and the checkpoint store.
 *
 * <p>Each setting is read as {@code redis.<role>.<name>} first and {@code redis.<name>} second,
 * so both stores can share one server or be pointed at separate ones.</p>
 */
final class RedisPools {

    private static final Logger log = LoggerFactory.getLogger(RedisPools.class);

    private RedisPools() {}

    static JedisPool fromConfig(KernelConfig config, String role) {
        final Endpoint endpoint = Endpoint.resolve(config, role);

        final JedisPoolConfig pooling = new JedisPoolConfig();
        pooling.setMaxTotal(endpoint.maxTotal);
        pooling.setMaxIdle(Math.min(endpoint.maxIdle, endpoint.maxTotal));
        pooling.setMinIdle(Math.min(endpoint.minIdle, endpoint.maxTotal));
        pooling.setTestOnBorrow(false);
        pooling.setTestWhileIdle(true);

        log.info("Redis {} pool -> {}:{} db={} tls={} max={}",
                role, endpoint.host, endpoint.port, endpoint.database, endpoint.tls, endpoint.maxTotal);
        return new JedisPool(pooling, endpoint.host, endpoint.port, endpoint.timeoutMs,
                endpoint.password, endpoint.database, endpoint.tls);
    }

    /** Connection settings for one role after fallback resolution. */
    static final class Endpoint {
        final String host;
        final int port;
        final String password;
        final int database;
        final boolean tls;
        final int timeoutMs;
        final int maxTotal;
        final int maxIdle;
        final int minIdle;

        private Endpoint(KernelConfig config, String role) {
            final String scoped = "redis." + role + ".";
            this.host = text(config, scoped, "host", "localhost");
            this.port = number(config, scoped, "port", Protocol.DEFAULT_PORT, 1, 65_535);
            final String secret = text(config, scoped, "password", "");
            this.password = secret.isEmpty() ? null : secret;
            this.database = number(config, scoped, "database", Protocol.DEFAULT_DATABASE, 0, 1_024);
            this.tls = Boolean.parseBoolean(text(config, scoped, "tls", "false"));
            this.timeoutMs = number(config, scoped, "timeout.ms", 2_000, 100, 60_000);
            this.maxTotal = number(config, scoped, "pool.max", 64, 1, 4_096);
            this.maxIdle = number(config, scoped, "pool.idle", 16, 0, 4_096);
            this.minIdle = number(config, scoped, "pool.min", 2, 0, 4_096);
        }

        static Endpoint resolve(KernelConfig config, String role) {
            return new Endpoint(config, role);
        }

        private static String text(KernelConfig config, String scoped, String name, String fallback) {
            final String shared = config.getString("redis." + name, fallback);
            final String value = config.getString(scoped + name, shared);
            return value == null ? fallback : value.trim();
        }

        private static int number(KernelConfig config, String scoped, String name, int fallback, int min, int max) {
            final int shared = config.getInt("redis." + name, fallback);
            final int value = config.getInt(scoped + name, shared);
            return Math.max(min, Math.min(max, value));
        }
    }
}
