/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.svm;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.chainkernel.core.ChainDecoder;
import com.intuitivedesigns.chainkernel.error.DecodeException;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RawRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes Solana-style records: slot heads and {@code json}-encoded block transactions.
 * A transaction that only touches the system program is a {@code native_transfer};
 * everything else is a {@code program_call}.
 */
public final class SvmDecoder implements ChainDecoder {

    public static final String CHAIN_TYPE = "svm";
    static final String SYSTEM_PROGRAM = "11111111111111111111111111111111";

    @Override
    public String chainType() {
        return CHAIN_TYPE;
    }

    @Override
    public NormalizedEvent decode(RawRecord record) throws DecodeException {
        if (record.isBlock()) {
            return decodeSlot(record);
        }

        final JsonNode tx = record.payload();
        final JsonNode message = tx.path("transaction").path("message");
        final JsonNode meta = tx.path("meta");
        final JsonNode signatures = tx.path("transaction").path("signatures");
        if (!signatures.isArray() || signatures.isEmpty() || !message.isObject()) {
            throw new DecodeException("SVM record at " + record.position() + " has no signature or message");
        }

        final List<String> accountKeys = new ArrayList<>();
        for (JsonNode key : message.path("accountKeys")) {
            // jsonParsed encoding wraps keys in objects
            accountKeys.add(key.isObject() ? key.path("pubkey").asText() : key.asText());
        }
        if (accountKeys.isEmpty()) {
            throw new DecodeException("SVM record at " + record.position() + " has no account keys");
        }

        final Set<String> programIds = new LinkedHashSet<>();
        for (JsonNode ix : message.path("instructions")) {
            final int idx = ix.path("programIdIndex").asInt(-1);
            if (idx < 0 || idx >= accountKeys.size()) {
                throw new DecodeException("SVM record at " + record.position() + " has a bad programIdIndex " + idx);
            }
            programIds.add(accountKeys.get(idx));
        }

        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("signature", signatures.get(0).asText());
        payload.put("slot", record.position().height());
        payload.put("block_time", tx.hasNonNull("blockTime") ? tx.get("blockTime").asLong() : null);
        payload.put("fee_payer", accountKeys.get(0));
        payload.put("fee", meta.path("fee").asLong(0));
        payload.put("success", meta.isObject() && meta.path("err").isNull());
        payload.put("account_keys", accountKeys);
        payload.put("program_ids", new ArrayList<>(programIds));

        if (programIds.size() == 1 && programIds.contains(SYSTEM_PROGRAM)) {
            final int recipient = largestCredit(meta, accountKeys.size());
            if (recipient > 0) {
                payload.put("from", accountKeys.get(0));
                payload.put("to", accountKeys.get(recipient));
                payload.put("lamports", balanceDelta(meta, recipient));
                return NormalizedEvent.from(record, "native_transfer", payload);
            }
        }
        return NormalizedEvent.from(record, "program_call", payload);
    }

    private static NormalizedEvent decodeSlot(RawRecord record) throws DecodeException {
        final JsonNode head = record.payload();
        if (!head.has("slot")) {
            throw new DecodeException("SVM slot record at " + record.position() + " has no 'slot'");
        }
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("slot", head.get("slot").asLong());
        payload.put("parent", head.hasNonNull("parent") ? head.get("parent").asLong() : null);
        payload.put("root", head.hasNonNull("root") ? head.get("root").asLong() : null);
        return NormalizedEvent.from(record, "block", payload);
    }

    /**
     * Index of the non-payer account with the largest balance increase, or -1.
     */
    private static int largestCredit(JsonNode meta, int accounts) {
        int best = -1;
        long bestDelta = 0;
        for (int i = 1; i < accounts; i++) {
            final long delta = balanceDelta(meta, i);
            if (delta > bestDelta) {
                bestDelta = delta;
                best = i;
            }
        }
        return best;
    }

    private static long balanceDelta(JsonNode meta, int index) {
        return meta.path("postBalances").path(index).asLong(0) - meta.path("preBalances").path(index).asLong(0);
    }
}
