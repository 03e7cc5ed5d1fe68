/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.chainkernel.error.ConfigException;

import java.nio.charset.StandardCharsets;

/**
 * JSON form of {@link SourceConfig} as stored in the registry:
 * <pre>{"id":"chainA-main","chain_type":"evm","endpoint":"wss://node.example",
 *  "credential_ref":"env:NODE_TOKEN","enabled":true,"start_position":"latest"}</pre>
 * The registry key is authoritative for the id; a body id that disagrees is rejected.
 */
public final class SourceConfigCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SourceConfigCodec() {}

    public static SourceConfig decode(String key, byte[] value) throws ConfigException {
        if (value == null) {
            throw new ConfigException(key, "empty value");
        }
        return decode(key, new String(value, StandardCharsets.UTF_8));
    }

    public static SourceConfig decode(String key, String json) throws ConfigException {
        final JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigException(key, "malformed JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new ConfigException(key, "expected a JSON object");
        }

        final String bodyId = text(node, "id");
        if (bodyId != null && key != null && !bodyId.equals(key)) {
            throw new ConfigException(key, "id '" + bodyId + "' does not match registry key");
        }

        final JsonNode enabled = node.get("enabled");
        if (enabled != null && !enabled.isBoolean()) {
            throw new ConfigException(key, "enabled must be a boolean");
        }

        try {
            return new SourceConfig(
                    bodyId != null ? bodyId : key,
                    text(node, "chain_type"),
                    text(node, "endpoint"),
                    text(node, "credential_ref"),
                    enabled == null || enabled.booleanValue(),
                    text(node, "start_position")
            );
        } catch (NullPointerException | IllegalArgumentException e) {
            throw new ConfigException(key, "invalid field: " + e.getMessage());
        }
    }

    public static String encode(SourceConfig config) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", config.id());
        node.put("chain_type", config.chainType());
        node.put("endpoint", config.endpoint());
        if (config.credentialRef() != null) node.put("credential_ref", config.credentialRef());
        node.put("enabled", config.enabled());
        if (config.startPosition() != null) node.put("start_position", config.startPosition());
        return node.toString();
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }
}
