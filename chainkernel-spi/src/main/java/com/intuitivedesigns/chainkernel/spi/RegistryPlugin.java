/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ConfigStore;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;

/**
 * Factory for the source registry client (ConfigStore).
 */
public interface RegistryPlugin extends PipelinePlugin<ConfigStore> {

    @Override
    default PluginKind kind() {
        return PluginKind.REGISTRY;
    }

    @Override
    ConfigStore create(KernelConfig config, MetricsRuntime metrics) throws Exception;
}
