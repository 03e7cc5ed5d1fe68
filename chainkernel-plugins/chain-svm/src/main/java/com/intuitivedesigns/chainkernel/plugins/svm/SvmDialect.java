/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.svm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.error.RpcErrorException;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@code getSlot} / {@code getBlock} polling and {@code slotSubscribe}.
 */
public final class SvmDialect implements RpcDialect {

    // Slot skipped, pruned from long-term storage, or not yet available
    private static final Set<Integer> NO_BLOCK_CODES = Set.of(-32004, -32007, -32009);

    private static final Map<String, Object> COMMITMENT = Map.of("commitment", "finalized");
    private static final Map<String, Object> BLOCK_OPTIONS = Map.of(
            "encoding", "json",
            "transactionDetails", "full",
            "rewards", false,
            "commitment", "finalized",
            "maxSupportedTransactionVersion", 0);

    private static final Subscription SLOTS = new Subscription("slotSubscribe", List.of());

    @Override
    public String chainType() {
        return SvmDecoder.CHAIN_TYPE;
    }

    @Override
    public long latestHeight(RpcClient rpc) throws SourceConnectException, InterruptedException {
        final JsonNode result = rpc.call("getSlot", COMMITMENT);
        if (!result.canConvertToLong()) {
            throw new SourceConnectException("getSlot returned " + result);
        }
        return result.asLong();
    }

    @Override
    public List<JsonNode> transactions(RpcClient rpc, long slot) throws SourceConnectException, InterruptedException {
        final JsonNode block;
        try {
            block = rpc.call("getBlock", slot, BLOCK_OPTIONS);
        } catch (RpcErrorException e) {
            if (NO_BLOCK_CODES.contains(e.code())) {
                return List.of();
            }
            throw e;
        }
        if (block == null || block.isNull()) {
            return List.of();
        }

        final JsonNode txs = block.path("transactions");
        final List<JsonNode> out = new ArrayList<>(txs.size());
        for (JsonNode tx : txs) {
            final ObjectNode enriched = ((ObjectNode) tx).deepCopy();
            enriched.set("blockTime", block.get("blockTime"));
            enriched.set("blockhash", block.get("blockhash"));
            out.add(enriched);
        }
        return out;
    }

    @Override
    public Optional<Subscription> subscription() {
        return Optional.of(SLOTS);
    }

    @Override
    public long headHeight(JsonNode head) {
        return head.path("slot").asLong();
    }
}
