/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.CheckpointStore;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;

/**
 * Factory for the checkpoint store.
 */
public interface CheckpointPlugin extends PipelinePlugin<CheckpointStore> {

    @Override
    default PluginKind kind() {
        return PluginKind.CHECKPOINT;
    }

    @Override
    CheckpointStore create(KernelConfig config, MetricsRuntime metrics) throws Exception;
}
