/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.utxo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UtxoDialectTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final UtxoDialect dialect = new UtxoDialect();

    @Test
    void testBlockFetchedByHash() throws Exception {
        List<String> calls = new ArrayList<>();
        RpcClient rpc = (method, params) -> {
            calls.add(method + Arrays.toString(params));
            if (method.equals("getblockhash")) {
                return MAPPER.readTree("\"00ff\"");
            }
            return MAPPER.readTree("{\"time\":1713571767,\"tx\":[{\"txid\":\"a\"},{\"txid\":\"b\"}]}");
        };

        List<JsonNode> txs = dialect.transactions(rpc, 840_000);

        assertEquals(List.of("getblockhash[840000]", "getblock[00ff, 2]"), calls);
        assertEquals(2, txs.size());
        assertEquals("b", txs.get(1).get("txid").asText());
        assertEquals("00ff", txs.get(1).get("blockhash").asText());
        assertEquals(840_000L, txs.get(0).get("blockheight").asLong());
        assertEquals(1_713_571_767L, txs.get(0).get("blocktime").asLong());
    }

    @Test
    void testLatestHeightAndNoSubscription() throws Exception {
        assertEquals(840_001L, dialect.latestHeight((method, params) -> MAPPER.readTree("840001")));
        assertTrue(dialect.subscription().isEmpty());
    }
}
