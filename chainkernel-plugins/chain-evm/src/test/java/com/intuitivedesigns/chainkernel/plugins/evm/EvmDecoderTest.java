/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.chainkernel.error.DecodeException;
import com.intuitivedesigns.chainkernel.model.ChainPosition;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EvmDecoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ALICE = "0x1111111111111111111111111111111111111111";
    private static final String CAROL_MIXED = "0xAbCdEf0000000000000000000000000000000001";
    private static final String BOB = "0x2222222222222222222222222222222222222222";
    private static final String TOKEN = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";

    private final EvmDecoder decoder = new EvmDecoder();

    private static RawRecord tx(String json) throws Exception {
        return record(RawRecord.KIND_TRANSACTION, json);
    }

    private static RawRecord record(String kind, String json) throws Exception {
        JsonNode payload = MAPPER.readTree(json.replace('\'', '"'));
        return new RawRecord("chainA-main", "evm", ChainPosition.of(19_000_000, 4), kind, payload,
                Instant.parse("2025-01-01T00:00:00Z"));
    }

    private static String pad(String hexNoPrefix) {
        return "0".repeat(64 - hexNoPrefix.length()) + hexNoPrefix;
    }

    @Test
    void testNativeTransfer() throws Exception {
        NormalizedEvent event = decoder.decode(tx("{'hash':'0xabc','from':'" + CAROL_MIXED
                + "','to':'" + BOB + "','value':'0xde0b6b3a7640000','input':'0x','blockTimestamp':'0x65920080'}"));

        assertEquals("native_transfer", event.eventType());
        assertEquals("0xabcdef0000000000000000000000000000000001", event.payload().get("from"));
        assertEquals(BOB, event.payload().get("to"));
        assertEquals("1000000000000000000", event.payload().get("value"));
        assertEquals(1_704_067_200L, event.payload().get("block_timestamp"));
        assertEquals("chainA-main:19000000:4", event.dedupKey());
    }

    @Test
    void testTokenTransfer() throws Exception {
        String input = "0xa9059cbb" + pad(BOB.substring(2)) + pad("f4240");
        NormalizedEvent event = decoder.decode(tx("{'hash':'0xabc','from':'" + ALICE + "','to':'" + TOKEN
                + "','value':'0x0','input':'" + input + "'}"));

        assertEquals("token_transfer", event.eventType());
        assertEquals(TOKEN, event.payload().get("token"));
        assertEquals(ALICE, event.payload().get("from"));
        assertEquals(BOB, event.payload().get("to"));
        assertEquals("1000000", event.payload().get("amount"));
    }

    @Test
    void testTokenTransferFrom() throws Exception {
        String input = "0x23b872dd" + pad(ALICE.substring(2)) + pad(BOB.substring(2)) + pad("64");
        NormalizedEvent event = decoder.decode(tx("{'hash':'0xabc','from':'" + BOB + "','to':'" + TOKEN
                + "','input':'" + input + "'}"));

        assertEquals("token_transfer", event.eventType());
        assertEquals(ALICE, event.payload().get("owner"));
        assertEquals(BOB, event.payload().get("to"));
        assertEquals("100", event.payload().get("amount"));
    }

    @Test
    void testContractCall() throws Exception {
        NormalizedEvent event = decoder.decode(tx("{'hash':'0xabc','from':'" + ALICE + "','to':'" + TOKEN
                + "','value':'0x0','input':'0x095ea7b3" + pad("1") + "'}"));

        assertEquals("contract_call", event.eventType());
        assertEquals("0x095ea7b3", event.payload().get("selector"));
    }

    @Test
    void testContractCreation() throws Exception {
        NormalizedEvent event = decoder.decode(tx("{'hash':'0xabc','from':'" + ALICE
                + "','to':null,'value':'0x0','input':'0x6080604052'}"));

        assertEquals("contract_creation", event.eventType());
        assertTrue(event.payload().containsKey("to"));
        assertNull(event.payload().get("to"));
        assertEquals("0x6080604052", event.payload().get("init_code"));
    }

    @Test
    void testBlockHead() throws Exception {
        NormalizedEvent event = decoder.decode(record(RawRecord.KIND_BLOCK,
                "{'number':'0x121eac0','hash':'0xhead','parentHash':'0xparent','timestamp':'0x65920080','baseFeePerGas':'0x3b9aca00'}"));

        assertEquals("block", event.eventType());
        assertEquals(19_000_000L, event.payload().get("number"));
        assertEquals("1000000000", event.payload().get("base_fee_per_gas"));
    }

    @Test
    void testMalformedRecords() {
        assertThrows(DecodeException.class, () -> decoder.decode(tx("{'from':'" + ALICE + "'}")));
        assertThrows(DecodeException.class, () -> decoder.decode(tx("{'hash':'0x1','from':'" + ALICE
                + "','to':'" + BOB + "','value':'lots'}")));
        assertThrows(DecodeException.class, () -> decoder.decode(record(RawRecord.KIND_BLOCK, "{'hash':'0x1'}")));
    }

    @Test
    void testDeterministic() throws Exception {
        RawRecord record = tx("{'hash':'0xabc','from':'" + ALICE + "','to':'" + BOB + "','value':'0x1'}");
        assertEquals(decoder.decode(record), decoder.decode(record));
    }
}
