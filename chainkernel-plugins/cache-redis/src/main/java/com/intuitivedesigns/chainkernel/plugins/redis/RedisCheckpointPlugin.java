/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.redis;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.CheckpointStore;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.CheckpointPlugin;

/**
 * ID: REDIS
 */
public final class RedisCheckpointPlugin implements CheckpointPlugin {

    public static final String ID = "REDIS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CheckpointStore create(KernelConfig config, MetricsRuntime metrics) {
        return new RedisCheckpointStore(RedisPools.fromConfig(config, "checkpoint"));
    }
}
