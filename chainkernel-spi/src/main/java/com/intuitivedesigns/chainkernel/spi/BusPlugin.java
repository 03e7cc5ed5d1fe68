/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.spi;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.EventBus;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;

/**
 * Factory for the event bus the publisher delivers to.
 */
public interface BusPlugin extends PipelinePlugin<EventBus> {

    @Override
    default PluginKind kind() {
        return PluginKind.BUS;
    }

    @Override
    EventBus create(KernelConfig config, MetricsRuntime metrics) throws Exception;
}
