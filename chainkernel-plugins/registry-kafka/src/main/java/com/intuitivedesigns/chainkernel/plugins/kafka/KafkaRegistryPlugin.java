/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.kafka;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ConfigStore;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.RegistryPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ID: KAFKA
 */
public final class KafkaRegistryPlugin implements RegistryPlugin {

    private static final Logger log = LoggerFactory.getLogger(KafkaRegistryPlugin.class);

    public static final String ID = "KAFKA";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ConfigStore create(KernelConfig config, MetricsRuntime metrics) {
        log.info("🔌 Initialized Kafka source registry (topic={})",
                config.getString(KafkaConfigStore.KEY_TOPIC, KafkaConfigStore.DEFAULT_TOPIC));
        return KafkaConfigStore.fromConfig(config);
    }
}
