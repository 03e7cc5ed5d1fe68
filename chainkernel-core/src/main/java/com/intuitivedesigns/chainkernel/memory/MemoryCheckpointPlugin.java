/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.memory;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.CheckpointStore;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.CheckpointPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ID: MEMORY
 */
public final class MemoryCheckpointPlugin implements CheckpointPlugin {

    public static final String ID = "MEMORY";
    private static final Logger log = LoggerFactory.getLogger(MemoryCheckpointPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CheckpointStore create(KernelConfig config, MetricsRuntime metrics) {
        log.warn("Creating in-memory checkpoint store: sources restart from their configured start position after a process restart");
        return new InMemoryCheckpointStore();
    }
}
