/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.utxo;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ChainSupport;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.spi.ChainPlugin;

/**
 * ID: UTXO
 */
public final class UtxoChainPlugin implements ChainPlugin {

    @Override
    public String id() {
        return UtxoDecoder.CHAIN_TYPE;
    }

    @Override
    public ChainSupport create(KernelConfig config, MetricsRuntime metrics) {
        return new ChainSupport(new UtxoDecoder(), new UtxoDialect());
    }
}
