/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code eth_blockNumber} / {@code eth_getBlockByNumber} polling and {@code eth_subscribe newHeads}.
 */
public final class EvmDialect implements RpcDialect {

    private static final Subscription NEW_HEADS = new Subscription("eth_subscribe", List.of("newHeads"));

    @Override
    public String chainType() {
        return EvmDecoder.CHAIN_TYPE;
    }

    @Override
    public long latestHeight(RpcClient rpc) throws SourceConnectException, InterruptedException {
        final JsonNode result = rpc.call("eth_blockNumber");
        try {
            return EvmHex.toLong(result.asText());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new SourceConnectException("eth_blockNumber returned " + result, e);
        }
    }

    @Override
    public List<JsonNode> transactions(RpcClient rpc, long height) throws SourceConnectException, InterruptedException {
        final JsonNode block = rpc.call("eth_getBlockByNumber", EvmHex.quantity(height), true);
        if (block == null || block.isNull()) {
            return List.of();
        }
        final JsonNode txs = block.path("transactions");
        final List<JsonNode> out = new ArrayList<>(txs.size());
        for (JsonNode tx : txs) {
            if (!tx.isObject()) {
                throw new SourceConnectException("eth_getBlockByNumber returned hashes only; full transactions required");
            }
            final ObjectNode enriched = ((ObjectNode) tx).deepCopy();
            enriched.set("blockTimestamp", block.get("timestamp"));
            if (!enriched.hasNonNull("blockHash")) enriched.set("blockHash", block.get("hash"));
            out.add(enriched);
        }
        return out;
    }

    @Override
    public Optional<Subscription> subscription() {
        return Optional.of(NEW_HEADS);
    }

    @Override
    public long headHeight(JsonNode head) {
        return EvmHex.toLong(head.path("number").asText());
    }
}
