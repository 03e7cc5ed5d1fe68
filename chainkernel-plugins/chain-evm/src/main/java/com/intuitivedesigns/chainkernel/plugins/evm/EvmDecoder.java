/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.chainkernel.core.ChainDecoder;
import com.intuitivedesigns.chainkernel.error.DecodeException;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RawRecord;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies Ethereum-style records.
 * <ul>
 *   <li>{@code block}: a new head</li>
 *   <li>{@code native_transfer}: value transfer without calldata</li>
 *   <li>{@code token_transfer}: ERC-20 {@code transfer} / {@code transferFrom}</li>
 *   <li>{@code contract_creation}: no recipient</li>
 *   <li>{@code contract_call}: anything else with calldata</li>
 * </ul>
 * Quantities are emitted as decimal strings so wei amounts never overflow.
 */
public final class EvmDecoder implements ChainDecoder {

    public static final String CHAIN_TYPE = "evm";

    @Override
    public String chainType() {
        return CHAIN_TYPE;
    }

    @Override
    public NormalizedEvent decode(RawRecord record) throws DecodeException {
        try {
            return record.isBlock() ? decodeHead(record) : decodeTransaction(record);
        } catch (NumberFormatException | ArithmeticException | StringIndexOutOfBoundsException e) {
            throw new DecodeException("Bad EVM record at " + record.position() + ": " + e.getMessage(), e);
        }
    }

    private static NormalizedEvent decodeHead(RawRecord record) throws DecodeException {
        final JsonNode head = record.payload();
        final String number = requireText(head, "number", record);

        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("number", EvmHex.toLong(number));
        payload.put("hash", text(head, "hash"));
        payload.put("parent_hash", text(head, "parentHash"));
        payload.put("timestamp", optionalLong(head, "timestamp"));
        payload.put("miner", lower(text(head, "miner")));
        payload.put("gas_used", optionalDecimal(head, "gasUsed"));
        payload.put("base_fee_per_gas", optionalDecimal(head, "baseFeePerGas"));
        return NormalizedEvent.from(record, "block", payload);
    }

    private static NormalizedEvent decodeTransaction(RawRecord record) throws DecodeException {
        final JsonNode tx = record.payload();
        final String hash = requireText(tx, "hash", record);
        final String from = lower(requireText(tx, "from", record));
        final String to = lower(text(tx, "to"));
        final String input = tx.hasNonNull("input") ? tx.get("input").asText() : text(tx, "data");
        final String value = EvmHex.toBigInteger(tx.path("value").asText("0x0")).toString();

        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("hash", hash);
        payload.put("block_hash", text(tx, "blockHash"));
        payload.put("block_timestamp", optionalLong(tx, "blockTimestamp"));
        payload.put("from", from);

        if (to == null) {
            payload.put("to", null);
            payload.put("value", value);
            payload.put("init_code", input);
            return NormalizedEvent.from(record, "contract_creation", payload);
        }

        if (EvmHex.isEmptyData(input)) {
            payload.put("to", to);
            payload.put("value", value);
            return NormalizedEvent.from(record, "native_transfer", payload);
        }

        final String selector = EvmHex.selector(input);
        if (EvmHex.SELECTOR_TRANSFER.equals(selector) && EvmHex.argumentWords(input) == 2) {
            payload.put("token", to);
            payload.put("to", EvmHex.addressWord(input, 0));
            payload.put("amount", EvmHex.uintWord(input, 1).toString());
            payload.put("function", "transfer");
            return NormalizedEvent.from(record, "token_transfer", payload);
        }
        if (EvmHex.SELECTOR_TRANSFER_FROM.equals(selector) && EvmHex.argumentWords(input) == 3) {
            payload.put("token", to);
            payload.put("owner", EvmHex.addressWord(input, 0));
            payload.put("to", EvmHex.addressWord(input, 1));
            payload.put("amount", EvmHex.uintWord(input, 2).toString());
            payload.put("function", "transferFrom");
            return NormalizedEvent.from(record, "token_transfer", payload);
        }

        payload.put("to", to);
        payload.put("value", value);
        payload.put("selector", selector == null ? null : "0x" + selector);
        payload.put("input", input);
        return NormalizedEvent.from(record, "contract_call", payload);
    }

    // --- Helpers ---

    private static String requireText(JsonNode node, String field, RawRecord record) throws DecodeException {
        final String v = text(node, field);
        if (v == null || v.isEmpty()) {
            throw new DecodeException("EVM record at " + record.position() + " has no '" + field + "'");
        }
        return v;
    }

    private static String text(JsonNode node, String field) {
        final JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static String lower(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }

    private static Long optionalLong(JsonNode node, String field) {
        final String v = text(node, field);
        return v == null ? null : EvmHex.toLong(v);
    }

    private static String optionalDecimal(JsonNode node, String field) {
        final String v = text(node, field);
        return v == null ? null : EvmHex.toBigInteger(v).toString();
    }
}
