/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.redis;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.DedupPlugin;

/**
 * ID: REDIS
 */
public final class RedisDedupPlugin implements DedupPlugin {

    public static final String ID = "REDIS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DedupCache create(KernelConfig config, MetricsRuntime metrics) {
        return new RedisDedupCache(RedisPools.fromConfig(config, "dedup"), metrics);
    }
}
