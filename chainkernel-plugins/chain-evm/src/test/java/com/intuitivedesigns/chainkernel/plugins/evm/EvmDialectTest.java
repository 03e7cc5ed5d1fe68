/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvmDialectTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EvmDialect dialect = new EvmDialect();
    private final List<String> calls = new ArrayList<>();

    private RpcClient answering(String json) {
        return (method, params) -> {
            calls.add(method + Arrays.toString(params));
            try {
                return json == null ? NullNode.getInstance() : MAPPER.readTree(json.replace('\'', '"'));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        };
    }

    @Test
    void testLatestHeight() throws Exception {
        assertEquals(19_000_000L, dialect.latestHeight(answering("'0x121eac0'")));
        assertEquals(List.of("eth_blockNumber[]"), calls);
    }

    @Test
    void testTransactionsCarryBlockContext() throws Exception {
        RpcClient rpc = answering("{'hash':'0xblock','timestamp':'0x10','transactions':["
                + "{'hash':'0xt1','from':'0xa'},{'hash':'0xt2','from':'0xb','blockHash':'0xblock'}]}");

        List<JsonNode> txs = dialect.transactions(rpc, 255);

        assertEquals(List.of("eth_getBlockByNumber[0xff, true]"), calls);
        assertEquals(2, txs.size());
        assertEquals("0x10", txs.get(0).get("blockTimestamp").asText());
        assertEquals("0xblock", txs.get(0).get("blockHash").asText());
        assertEquals("0xt2", txs.get(1).get("hash").asText());
    }

    @Test
    void testMissingBlockIsEmpty() throws Exception {
        assertTrue(dialect.transactions(answering(null), 1).isEmpty());
    }

    @Test
    void testHashOnlyBlockRejected() {
        assertThrows(SourceConnectException.class,
                () -> dialect.transactions(answering("{'hash':'0xb','transactions':['0xt1']}"), 1));
    }

    @Test
    void testNewHeadsSubscription() throws Exception {
        RpcDialect.Subscription sub = dialect.subscription().orElseThrow();
        assertEquals("eth_subscribe", sub.method());
        assertEquals(List.of("newHeads"), sub.params());
        assertEquals(16L, dialect.headHeight(MAPPER.readTree("{\"number\":\"0x10\"}")));
    }
}
