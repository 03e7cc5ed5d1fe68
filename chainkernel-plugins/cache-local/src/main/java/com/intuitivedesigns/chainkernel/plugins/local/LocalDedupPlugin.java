/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.local;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.DedupPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * In-process dedup filter. Not shared across kernel instances and lost on restart, so it only
 * suppresses replays within one process lifetime.
 */
public final class LocalDedupPlugin implements DedupPlugin {

    public static final String ID = "LOCAL";
    private static final Logger log = LoggerFactory.getLogger(LocalDedupPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DedupCache create(KernelConfig config, MetricsRuntime metrics) {
        long maxSize = config.getLong("dedup.local.max.size", 1_000_000);

        log.info("Creating Local Dedup Cache (Size={})", maxSize);
        return new LocalDedupCache(maxSize, Ticker.systemTicker());
    }

    // Caffeine with per-entry TTL; the value is the entry's lifetime in nanos
    static final class LocalDedupCache implements DedupCache {
        private final Cache<String, Long> underlying;

        LocalDedupCache(long maxSize, Ticker ticker) {
            this.underlying = Caffeine.newBuilder()
                    .maximumSize(maxSize)
                    .ticker(ticker)
                    .expireAfter(new Expiry<String, Long>() {
                        @Override
                        public long expireAfterCreate(String key, Long ttlNanos, long currentTime) {
                            return ttlNanos;
                        }

                        @Override
                        public long expireAfterUpdate(String key, Long ttlNanos, long currentTime, long currentDuration) {
                            return ttlNanos;
                        }

                        @Override
                        public long expireAfterRead(String key, Long ttlNanos, long currentTime, long currentDuration) {
                            return currentDuration;
                        }
                    })
                    .build();
        }

        @Override
        public boolean seen(String dedupKey) {
            return dedupKey != null && underlying.getIfPresent(dedupKey) != null;
        }

        @Override
        public void mark(String dedupKey, Duration ttl) {
            if (dedupKey != null && ttl != null && !ttl.isNegative() && !ttl.isZero()) {
                underlying.put(dedupKey, ttl.toNanos());
            }
        }

        long estimatedSize() {
            underlying.cleanUp();
            return underlying.estimatedSize();
        }

        @Override
        public void close() {
            underlying.invalidateAll();
            underlying.cleanUp();
        }
    }
}
