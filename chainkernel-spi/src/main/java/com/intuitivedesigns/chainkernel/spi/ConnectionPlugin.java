/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ConnectionFactory;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;

/**
 * Factory for source connections (transport per endpoint scheme).
 */
public interface ConnectionPlugin extends PipelinePlugin<ConnectionFactory> {

    @Override
    default PluginKind kind() {
        return PluginKind.CONNECTION;
    }

    @Override
    ConnectionFactory create(KernelConfig config, MetricsRuntime metrics) throws Exception;
}
