/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ChainSupport;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;

/**
 * Contributes one chain type (decoder + RPC dialect). The plugin id is the chain type.
 * Chain plugins are collected once at bootstrap into an immutable registry.
 */
public interface ChainPlugin extends PipelinePlugin<ChainSupport> {

    @Override
    default PluginKind kind() {
        return PluginKind.CHAIN;
    }

    @Override
    ChainSupport create(KernelConfig config, MetricsRuntime metrics);
}
