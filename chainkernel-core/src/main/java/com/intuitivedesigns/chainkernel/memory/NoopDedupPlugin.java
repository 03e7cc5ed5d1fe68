/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.memory;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.DedupPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * A pass-through dedup cache: nothing is ever seen, marks are discarded.
 * Downstream consumers still dedup on the bus message's dedup key.
 * <p>
 * ID: NOOP
 */
public final class NoopDedupPlugin implements DedupPlugin {

    public static final String ID = "NOOP";
    private static final Logger log = LoggerFactory.getLogger(NoopDedupPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DedupCache create(KernelConfig config, MetricsRuntime metrics) {
        log.info("Creating No-Op dedup cache");
        return new NoopDedupCache();
    }

    static final class NoopDedupCache implements DedupCache {

        @Override
        public boolean seen(String dedupKey) {
            return false;
        }

        @Override
        public void mark(String dedupKey, Duration ttl) {
            // No-op
        }
    }
}
