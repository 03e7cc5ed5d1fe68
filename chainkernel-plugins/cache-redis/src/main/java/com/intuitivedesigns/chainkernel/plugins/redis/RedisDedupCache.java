/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.redis;

import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.error.CacheException;
import com.intuitivedesigns.chainkernel.logging.ThrottledLog;
import com.intuitivedesigns.chainkernel.metrics.KernelMetrics;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Best-effort dedup filter on Redis ({@code EXISTS} / {@code SETEX}).
 *
 * <p>Never throws to the caller: when Redis is unavailable {@link #seen} answers {@code false}
 * and {@link #mark} does nothing, so the bus may receive a duplicate but no event is dropped.</p>
 */
public final class RedisDedupCache implements DedupCache {

    private static final Logger log = LoggerFactory.getLogger(RedisDedupCache.class);
    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;

    public static final String KEY_PREFIX = "chainkernel:dedup:";

    private final JedisPool pool;
    private final MetricsRuntime metrics;

    private final LongAdder errors = new LongAdder();
    private final ThrottledLog errorLog = ThrottledLog.warn(log, ERROR_LOG_INTERVAL_MS);

    public RedisDedupCache(JedisPool pool, MetricsRuntime metrics) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.metrics = metrics == null ? MetricsRuntime.noop() : metrics;
    }

    @Override
    public boolean seen(String dedupKey) {
        if (dedupKey == null) return false;
        final long startedNs = System.nanoTime();
        boolean hit = false;
        try (Jedis redis = pool.getResource()) {
            hit = redis.exists(KEY_PREFIX + dedupKey);
            metrics.counter(hit ? "cache.hits" : "cache.misses", 1.0);
        } catch (RuntimeException e) {
            onError("Redis EXISTS failed key=" + dedupKey, e);
        }
        observe(startedNs);
        return hit;
    }

    @Override
    public void mark(String dedupKey, Duration ttl) {
        if (dedupKey == null) return;
        final long startedNs = System.nanoTime();
        final long ttlSeconds = ttl == null ? 1L : Math.max(1L, ttl.toSeconds());
        try (Jedis redis = pool.getResource()) {
            redis.setex(KEY_PREFIX + dedupKey, ttlSeconds, "1");
        } catch (RuntimeException e) {
            onError("Redis SETEX failed key=" + dedupKey, e);
        }
        observe(startedNs);
    }

    @Override
    public void verify() throws CacheException {
        try (Jedis redis = pool.getResource()) {
            redis.ping();
        } catch (RuntimeException e) {
            throw new CacheException("Redis dedup cache unreachable: " + e.getMessage(), e);
        }
    }

    public long errorCount() {
        return errors.sum();
    }

    @Override
    public void close() {
        if (!pool.isClosed()) {
            pool.close();
        }
    }

    private void onError(String context, RuntimeException e) {
        errors.increment();
        metrics.counter(KernelMetrics.CACHE_ERRORS);
        errorLog.report(context, e);
    }

    private void observe(long startedNs) {
        metrics.timer("cache.latency", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNs));
    }
}
