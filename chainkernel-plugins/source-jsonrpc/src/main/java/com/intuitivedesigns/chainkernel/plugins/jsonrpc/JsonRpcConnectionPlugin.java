/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.jsonrpc;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ConnectionFactory;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.ConnectionPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ID: JSONRPC
 */
public final class JsonRpcConnectionPlugin implements ConnectionPlugin {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcConnectionPlugin.class);

    public static final String ID = "JSONRPC";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ConnectionFactory create(KernelConfig config, MetricsRuntime metrics) {
        log.info("🔌 Initialized JSON-RPC connections (poll every {}ms, up to {} blocks per poll)",
                config.getLong(JsonRpcConnectionFactory.KEY_POLL_INTERVAL_MS, 2000L),
                config.getInt(JsonRpcConnectionFactory.KEY_POLL_MAX_BLOCKS, 10));
        return JsonRpcConnectionFactory.fromConfig(config);
    }
}
