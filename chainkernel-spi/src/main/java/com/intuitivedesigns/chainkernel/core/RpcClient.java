/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;

/**
 * Minimal JSON-RPC 2.0 call surface handed to {@link RpcDialect}s.
 */
public interface RpcClient {

    /**
     * @return the {@code result} member of the response (may be a JSON null)
     * @throws SourceConnectException on transport failure or a JSON-RPC error object
     */
    JsonNode call(String method, Object... params) throws SourceConnectException, InterruptedException;
}
