/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical, chain-independent representation of one decoded raw record. Immutable.
 *
 * <p>{@code dedupKey} is a pure function of (sourceId, position): re-decoding the same record
 * always yields the same key, which downstream consumers use as the idempotency token.</p>
 */
public record NormalizedEvent(String sourceId,
                              String chainType,
                              ChainPosition position,
                              String eventType,
                              Map<String, Object> payload,
                              String dedupKey,
                              Instant ingestedAt) {

    public NormalizedEvent {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(chainType, "chainType");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(dedupKey, "dedupKey");
        Objects.requireNonNull(ingestedAt, "ingestedAt");
        // Values may legitimately be null (e.g. no recipient on contract creation), so no Map.copyOf
        payload = (payload == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Builds the event for a decoded record, deriving the dedup key from the record's position.
     */
    public static NormalizedEvent from(RawRecord record, String eventType, Map<String, Object> payload) {
        Objects.requireNonNull(record, "record");
        return new NormalizedEvent(
                record.sourceId(),
                record.chainType(),
                record.position(),
                eventType,
                payload,
                dedupKey(record.sourceId(), record.position()),
                record.receivedAt()
        );
    }

    public static String dedupKey(String sourceId, ChainPosition position) {
        return sourceId + ":" + position.height() + ":" + position.index();
    }
}
