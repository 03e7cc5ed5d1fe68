/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.utxo;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.chainkernel.core.ChainDecoder;
import com.intuitivedesigns.chainkernel.error.DecodeException;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RawRecord;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes Bitcoin-style transactions from {@code getblock <hash> 2}.
 *
 * <p>Amounts arrive in whole coins and are converted exactly to satoshis. A value with more than
 * eight decimals is malformed.</p>
 */
public final class UtxoDecoder implements ChainDecoder {

    public static final String CHAIN_TYPE = "utxo";

    @Override
    public String chainType() {
        return CHAIN_TYPE;
    }

    @Override
    public NormalizedEvent decode(RawRecord record) throws DecodeException {
        final JsonNode tx = record.payload();
        final String txid = tx.path("txid").asText(null);
        if (txid == null || txid.isEmpty()) {
            throw new DecodeException("UTXO record at " + record.position() + " has no 'txid'");
        }

        final List<Map<String, Object>> inputs = new ArrayList<>();
        boolean coinbase = false;
        for (JsonNode vin : tx.path("vin")) {
            if (vin.has("coinbase")) {
                coinbase = true;
                continue;
            }
            final Map<String, Object> in = new LinkedHashMap<>();
            in.put("txid", vin.path("txid").asText(null));
            in.put("vout", vin.path("vout").asLong(0));
            final JsonNode prevout = vin.path("prevout");
            if (prevout.isObject()) {
                in.put("address", address(prevout.path("scriptPubKey")));
                in.put("value_sats", sats(prevout.path("value"), record));
            }
            inputs.add(in);
        }

        final List<Map<String, Object>> outputs = new ArrayList<>();
        final Set<String> addresses = new LinkedHashSet<>();
        long totalOut = 0;
        for (JsonNode vout : tx.path("vout")) {
            final long value = sats(vout.path("value"), record);
            final String address = address(vout.path("scriptPubKey"));
            final Map<String, Object> out = new LinkedHashMap<>();
            out.put("n", vout.path("n").asLong(outputs.size()));
            out.put("address", address);
            out.put("value_sats", value);
            outputs.add(out);
            if (address != null) {
                addresses.add(address);
            }
            totalOut = Math.addExact(totalOut, value);
        }

        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("txid", txid);
        payload.put("block_hash", tx.path("blockhash").asText(null));
        payload.put("block_time", tx.hasNonNull("blocktime") ? tx.get("blocktime").asLong() : null);
        payload.put("size", tx.path("size").asLong(0));
        payload.put("weight", tx.hasNonNull("weight") ? tx.get("weight").asLong() : null);
        payload.put("inputs", inputs);
        payload.put("outputs", outputs);
        payload.put("total_out_sats", totalOut);
        payload.put("addresses", new ArrayList<>(addresses));
        payload.put("fee_sats", tx.hasNonNull("fee") ? sats(tx.get("fee"), record) : null);

        return NormalizedEvent.from(record, coinbase ? "coinbase" : "transfer", payload);
    }

    private static String address(JsonNode scriptPubKey) {
        if (scriptPubKey.hasNonNull("address")) {
            return scriptPubKey.get("address").asText();
        }
        // Pre-22.0 nodes report a list
        final JsonNode legacy = scriptPubKey.path("addresses");
        return legacy.isArray() && !legacy.isEmpty() ? legacy.get(0).asText() : null;
    }

    private static long sats(JsonNode coins, RawRecord record) throws DecodeException {
        if (!coins.isNumber() && !coins.isTextual()) {
            throw new DecodeException("UTXO record at " + record.position() + " has a missing amount");
        }
        try {
            return new BigDecimal(coins.asText()).movePointRight(8).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new DecodeException("UTXO record at " + record.position() + " has a bad amount '" + coins.asText() + "'", e);
        }
    }
}
