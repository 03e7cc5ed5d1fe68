/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.utxo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code getblockcount} / {@code getblockhash} / {@code getblock}. Bitcoin Core has no JSON-RPC
 * push channel, so there is no subscription.
 */
public final class UtxoDialect implements RpcDialect {

    private static final int VERBOSITY_FULL_TX = 2;

    @Override
    public String chainType() {
        return UtxoDecoder.CHAIN_TYPE;
    }

    @Override
    public long latestHeight(RpcClient rpc) throws SourceConnectException, InterruptedException {
        final JsonNode count = rpc.call("getblockcount");
        if (!count.canConvertToLong()) {
            throw new SourceConnectException("getblockcount returned " + count);
        }
        return count.asLong();
    }

    @Override
    public List<JsonNode> transactions(RpcClient rpc, long height) throws SourceConnectException, InterruptedException {
        final JsonNode hash = rpc.call("getblockhash", height);
        if (!hash.isTextual()) {
            throw new SourceConnectException("getblockhash(" + height + ") returned " + hash);
        }
        final JsonNode block = rpc.call("getblock", hash.asText(), VERBOSITY_FULL_TX);
        if (block == null || block.isNull()) {
            return List.of();
        }

        final List<JsonNode> out = new ArrayList<>();
        for (JsonNode tx : block.path("tx")) {
            if (!tx.isObject()) {
                throw new SourceConnectException("getblock returned txid-only block at " + height);
            }
            final ObjectNode enriched = ((ObjectNode) tx).deepCopy();
            enriched.put("blockhash", hash.asText());
            enriched.put("blockheight", height);
            enriched.set("blocktime", block.get("time"));
            out.add(enriched);
        }
        return out;
    }
}
