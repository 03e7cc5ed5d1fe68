/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.jsonrpc;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ConnectionFactory;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.core.SourceConnection;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import com.intuitivedesigns.chainkernel.model.SourceConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * Picks the transport from the endpoint scheme: {@code http(s)} polls, {@code ws(s)} subscribes to
 * heads and fetches blocks over the same socket. Both resume from {@code fromHeight}.
 */
public final class JsonRpcConnectionFactory implements ConnectionFactory {

    public static final String KEY_POLL_INTERVAL_MS = "source.poll.interval.ms";
    public static final String KEY_POLL_MAX_BLOCKS = "source.poll.max.blocks";
    public static final String KEY_REQUEST_TIMEOUT_MS = "source.rpc.timeout.ms";
    public static final String KEY_CONNECT_TIMEOUT_MS = "source.connect.timeout.ms";

    private final HttpClient http;
    private final CredentialResolver credentials;
    private final Duration pollInterval;
    private final int maxBlocksPerPoll;
    private final Duration requestTimeout;
    private final Duration connectTimeout;

    JsonRpcConnectionFactory(KernelConfig config, UnaryOperator<String> env) {
        this.credentials = new CredentialResolver(config, env);
        this.pollInterval = config.getMillis(KEY_POLL_INTERVAL_MS, 2000L);
        this.maxBlocksPerPoll = Math.max(1, config.getInt(KEY_POLL_MAX_BLOCKS, 10));
        this.requestTimeout = config.getMillis(KEY_REQUEST_TIMEOUT_MS, 10_000L);
        this.connectTimeout = config.getMillis(KEY_CONNECT_TIMEOUT_MS, 5_000L);
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public static JsonRpcConnectionFactory fromConfig(KernelConfig config) {
        return new JsonRpcConnectionFactory(config, System::getenv);
    }

    @Override
    public SourceConnection open(SourceConfig config, RpcDialect dialect, OptionalLong fromHeight)
            throws SourceConnectException, InterruptedException {
        if (dialect == null) {
            throw new SourceConnectException("No RPC dialect registered for chain type '" + config.chainType() + "'");
        }

        final String secret = credentials.resolve(config.credentialRef());
        final String raw = config.endpoint();
        final boolean inline = raw.contains(CredentialResolver.PLACEHOLDER);
        if (inline && secret == null) {
            throw new SourceConnectException("Endpoint of '" + config.id() + "' expects a credential but none is configured");
        }
        final URI endpoint;
        try {
            endpoint = URI.create(inline ? raw.replace(CredentialResolver.PLACEHOLDER, secret) : raw);
        } catch (IllegalArgumentException e) {
            throw new SourceConnectException("Invalid endpoint for '" + config.id() + "'", e);
        }
        final String bearer = inline ? null : secret;
        final String scheme = endpoint.getScheme() == null ? "" : endpoint.getScheme().toLowerCase(Locale.ROOT);

        switch (scheme) {
            case "http", "https" -> {
                final HttpJsonRpcClient rpc = new HttpJsonRpcClient(http, endpoint, bearer, requestTimeout);
                return new PollingConnection(config.id(), dialect, rpc, fromHeight, pollInterval, maxBlocksPerPoll);
            }
            case "ws", "wss" -> {
                final RpcDialect.Subscription subscription = dialect.subscription().orElseThrow(() ->
                        new SourceConnectException("Chain type '" + config.chainType() + "' has no subscription; use an http(s) endpoint"));
                return SubscriptionConnection.open(http, endpoint, bearer, config.id(), dialect, subscription,
                        fromHeight, maxBlocksPerPoll, connectTimeout, requestTimeout);
            }
            default -> throw new SourceConnectException("Unsupported endpoint scheme '" + scheme + "' for '" + config.id() + "'");
        }
    }
}
