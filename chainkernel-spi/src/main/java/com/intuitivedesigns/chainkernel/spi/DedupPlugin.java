/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.DedupCache;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;

/**
 * Factory for the shared dedup cache.
 */
public interface DedupPlugin extends PipelinePlugin<DedupCache> {

    @Override
    default PluginKind kind() {
        return PluginKind.DEDUP;
    }

    @Override
    DedupCache create(KernelConfig config, MetricsRuntime metrics) throws Exception;
}
