/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bus wire format of a {@link NormalizedEvent}:
 * <pre>{"source_id":"chainA-main","chain_type":"evm","height":19000000,"index":3,
 *  "event_type":"native_transfer","payload":{...},"dedup_key":"chainA-main:19000000:3",
 *  "ingested_at":"2025-01-01T00:00:00Z"}</pre>
 */
public final class EventCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventCodec() {}

    public static String toJson(NormalizedEvent event) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("source_id", event.sourceId());
        node.put("chain_type", event.chainType());
        node.put("height", event.position().height());
        node.put("index", event.position().index());
        node.put("event_type", event.eventType());
        node.set("payload", MAPPER.valueToTree(event.payload()));
        node.put("dedup_key", event.dedupKey());
        node.put("ingested_at", event.ingestedAt().toString());
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable: " + event.dedupKey(), e);
        }
    }

    public static NormalizedEvent fromJson(String json) throws JsonProcessingException {
        final JsonNode node = MAPPER.readTree(json);
        @SuppressWarnings("unchecked")
        final Map<String, Object> payload = MAPPER.convertValue(node.path("payload"), LinkedHashMap.class);
        return new NormalizedEvent(
                node.path("source_id").asText(),
                node.path("chain_type").asText(),
                ChainPosition.of(node.path("height").asLong(), node.path("index").asInt()),
                node.path("event_type").asText(),
                payload,
                node.path("dedup_key").asText(),
                Instant.parse(node.path("ingested_at").asText())
        );
    }
}
