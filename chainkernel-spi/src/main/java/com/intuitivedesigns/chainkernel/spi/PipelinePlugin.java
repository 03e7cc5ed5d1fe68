/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;

/**
 * Base contract for every ServiceLoader-discovered component factory.
 *
 * @param <T> the component type this plugin creates
 */
public interface PipelinePlugin<T> {

    /**
     * @return unique id within its kind (e.g. 'KAFKA', 'REDIS', 'EVM'); matched case-insensitively
     */
    String id();

    PluginKind kind();

    T create(KernelConfig config, MetricsRuntime metrics) throws Exception;
}
