/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import com.intuitivedesigns.chainkernel.model.SourceConfig;

import java.util.OptionalLong;

/**
 * Opens source connections. Shared by all workers.
 */
public interface ConnectionFactory extends AutoCloseable {

    /**
     * @param dialect    how to speak to this chain type, or {@code null} if none is registered
     * @param fromHeight first height to read; empty means start at the chain head
     */
    SourceConnection open(SourceConfig config, RpcDialect dialect, OptionalLong fromHeight)
            throws SourceConnectException, InterruptedException;

    @Override
    default void close() {}
}
