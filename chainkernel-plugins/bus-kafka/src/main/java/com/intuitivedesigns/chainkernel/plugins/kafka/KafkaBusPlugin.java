/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.kafka;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.EventBus;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.BusPlugin;

/**
 * ID: KAFKA
 */
public final class KafkaBusPlugin implements BusPlugin {

    public static final String ID = "KAFKA";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventBus create(KernelConfig config, MetricsRuntime metrics) {
        return KafkaEventBus.fromConfig(config, metrics);
    }
}
