/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One undecoded record as read from a source connection.
 *
 * @param kind {@link #KIND_TRANSACTION} or {@link #KIND_BLOCK}
 */
public record RawRecord(String sourceId,
                        String chainType,
                        ChainPosition position,
                        String kind,
                        JsonNode payload,
                        Instant receivedAt) {

    public static final String KIND_TRANSACTION = "transaction";
    public static final String KIND_BLOCK = "block";

    public RawRecord {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(chainType, "chainType");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public boolean isBlock() {
        return KIND_BLOCK.equals(kind);
    }
}
