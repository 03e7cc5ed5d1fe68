/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;

import java.util.List;
import java.util.Optional;

/**
 * How to read one chain type over JSON-RPC.
 */
public interface RpcDialect {

    String chainType();

    /**
     * Current head height (block number, slot, block count).
     */
    long latestHeight(RpcClient rpc) throws SourceConnectException, InterruptedException;

    /**
     * Transactions at one height, in chain order, each enriched with its block context.
     * Returns an empty list for a height with no block (e.g. a skipped slot).
     */
    List<JsonNode> transactions(RpcClient rpc, long height) throws SourceConnectException, InterruptedException;

    /**
     * Push subscription for new heads, if the chain offers one.
     */
    default Optional<Subscription> subscription() {
        return Optional.empty();
    }

    /**
     * Height of a head delivered by {@link #subscription()}.
     */
    default long headHeight(JsonNode head) {
        throw new UnsupportedOperationException("No subscription for " + chainType());
    }

    record Subscription(String method, List<Object> params) {
        public Subscription {
            params = List.copyOf(params);
        }
    }
}
