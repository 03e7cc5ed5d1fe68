/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.error.RpcErrorException;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over HTTP POST. One instance per source connection.
 */
final class HttpJsonRpcClient implements RpcClient {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;
    private final URI endpoint;
    private final String bearer;
    private final Duration requestTimeout;
    private final AtomicLong ids = new AtomicLong();

    HttpJsonRpcClient(HttpClient http, URI endpoint, String bearer, Duration requestTimeout) {
        this.http = http;
        this.endpoint = endpoint;
        this.bearer = bearer;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public JsonNode call(String method, Object... params) throws SourceConnectException, InterruptedException {
        final String body = requestBody(ids.incrementAndGet(), method, params);

        final HttpRequest.Builder req = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", "ChainKernel/1.0")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (bearer != null) {
            req.header("Authorization", "Bearer " + bearer);
        }

        final HttpResponse<String> response;
        try {
            response = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceConnectException(method + " to " + endpoint.getHost() + " failed: " + e.getMessage(), e);
        }
        if (response.statusCode() != 200) {
            throw new SourceConnectException(method + " returned HTTP " + response.statusCode());
        }
        return parseResponse(method, response.body());
    }

    static String requestBody(long id, String method, Object... params) {
        final ObjectNode req = MAPPER.createObjectNode();
        req.put("jsonrpc", "2.0");
        req.put("id", id);
        req.put("method", method);
        req.set("params", MAPPER.valueToTree(params == null ? new Object[0] : Arrays.asList(params)));
        return req.toString();
    }

    /**
     * @return the {@code result} member
     * @throws RpcErrorException the response carries an {@code error} object
     */
    static JsonNode parseResponse(String method, String body) throws SourceConnectException {
        final JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new SourceConnectException(method + " returned unparseable JSON", e);
        }
        return resultOf(method, root);
    }

    /**
     * @return the {@code result} member of an already parsed response
     * @throws RpcErrorException the response carries an {@code error} object
     */
    static JsonNode resultOf(String method, JsonNode root) throws SourceConnectException {
        final JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw new RpcErrorException(method, error.path("code").asInt(0), error.path("message").asText(error.toString()));
        }
        if (!root.has("result")) {
            throw new SourceConnectException(method + " response has no 'result'");
        }
        return root.get("result");
    }
}
