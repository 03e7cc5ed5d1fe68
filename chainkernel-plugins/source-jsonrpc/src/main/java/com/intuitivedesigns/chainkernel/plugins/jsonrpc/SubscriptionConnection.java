/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.core.SourceConnection;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import com.intuitivedesigns.chainkernel.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC over one WebSocket: a head subscription drives block fetches made on the same socket.
 *
 * <p>Pushed heads only raise the known chain height. The worker thread then walks every height
 * from the resume point up to that head through {@link BlockWalker}, so records carry the same
 * {@code (height, index)} positions as the polling transport and nothing produced while the
 * socket was down is skipped. On open the head is seeded from the node so catch-up starts at once.</p>
 */
final class SubscriptionConnection implements SourceConnection, RpcClient, WebSocket.Listener {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionConnection.class);
    private static final long SUBSCRIBE_ID = 1L;

    /** Outbound frame writer; the live socket in production. */
    interface Outbound {
        CompletableFuture<?> send(String frame);
    }

    private record PendingCall(String method, CompletableFuture<JsonNode> reply) {}

    private final String sourceId;
    private final RpcDialect dialect;
    private final Duration requestTimeout;
    private final BlockWalker walker;

    private final AtomicLong ids = new AtomicLong(SUBSCRIBE_ID);
    private final Map<Long, PendingCall> pending = new ConcurrentHashMap<>();
    private final AtomicLong knownHead = new AtomicLong(-1L);
    private final Semaphore headArrived = new Semaphore(0);
    private final StringBuilder partial = new StringBuilder();

    private volatile Outbound outbound;
    private volatile WebSocket socket;
    private volatile SourceConnectException failure;

    private SubscriptionConnection(String sourceId,
                                   RpcDialect dialect,
                                   OptionalLong fromHeight,
                                   int maxBlocksPerStep,
                                   Duration requestTimeout) {
        this.sourceId = sourceId;
        this.dialect = dialect;
        this.requestTimeout = requestTimeout;
        this.walker = new BlockWalker(sourceId, dialect, this, fromHeight, maxBlocksPerStep);
    }

    static SubscriptionConnection open(HttpClient http,
                                       URI endpoint,
                                       String bearer,
                                       String sourceId,
                                       RpcDialect dialect,
                                       RpcDialect.Subscription subscription,
                                       OptionalLong fromHeight,
                                       int maxBlocksPerStep,
                                       Duration connectTimeout,
                                       Duration requestTimeout) throws SourceConnectException, InterruptedException {
        final SubscriptionConnection conn =
                new SubscriptionConnection(sourceId, dialect, fromHeight, maxBlocksPerStep, requestTimeout);
        final WebSocket.Builder builder = http.newWebSocketBuilder().connectTimeout(connectTimeout);
        if (bearer != null) {
            builder.header("Authorization", "Bearer " + bearer);
        }

        try {
            final WebSocket ws = builder.buildAsync(endpoint, conn).get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            conn.socket = ws;
            conn.outbound = frame -> ws.sendText(frame, true);
            conn.subscribe(subscription);
            conn.offerHead(dialect.latestHeight(conn));
        } catch (ExecutionException e) {
            conn.close();
            throw new SourceConnectException("WebSocket connect to " + endpoint.getHost() + " failed: " + e.getCause(), e.getCause());
        } catch (TimeoutException e) {
            conn.close();
            throw new SourceConnectException("WebSocket connect to " + endpoint.getHost() + " timed out", e);
        } catch (SourceConnectException | InterruptedException | RuntimeException e) {
            conn.close();
            throw e;
        }
        log.info("Source '{}' subscribed via {} (head {})", sourceId, subscription.method(), conn.knownHead.get());
        return conn;
    }

    private void subscribe(RpcDialect.Subscription subscription)
            throws ExecutionException, TimeoutException, InterruptedException {
        final String request = HttpJsonRpcClient.requestBody(SUBSCRIBE_ID, subscription.method(),
                subscription.params().toArray());
        outbound.send(request).get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public RawRecord next(Duration timeout) throws SourceConnectException, InterruptedException {
        if (walker.hasBuffered()) {
            return walker.poll();
        }
        final SourceConnectException dead = failure;
        if (dead != null) {
            throw dead;
        }

        final long head = knownHead.get();
        if (head >= 0 && walker.isBehind(head)) {
            walker.walkTo(head);
            return walker.poll();
        }

        if (headArrived.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            headArrived.drainPermits();
        }
        return null;
    }

    // ---- RpcClient over the socket ----

    @Override
    public JsonNode call(String method, Object... params) throws SourceConnectException, InterruptedException {
        final long id = ids.incrementAndGet();
        final PendingCall call = new PendingCall(method, new CompletableFuture<>());
        pending.put(id, call);
        try {
            final SourceConnectException dead = failure;
            if (dead != null) {
                throw dead;
            }
            outbound.send(HttpJsonRpcClient.requestBody(id, method, params))
                    .get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return call.reply().get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof SourceConnectException sce) {
                throw sce;
            }
            throw new SourceConnectException(method + " over WebSocket failed: " + e.getCause(), e.getCause());
        } catch (TimeoutException e) {
            throw new SourceConnectException(method + " over WebSocket timed out after " + requestTimeout.toMillis() + "ms", e);
        } finally {
            pending.remove(id);
        }
    }

    @Override
    public void close() {
        final WebSocket ws = socket;
        if (ws != null && !ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
        }
        if (ws != null) {
            ws.abort();
        }
        walker.clear();
        final SourceConnectException closed = new SourceConnectException("Connection closed");
        if (failure == null) {
            failure = closed;
        }
        abandonPending(closed);
    }

    // ---- WebSocket.Listener ----

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        partial.append(data);
        if (last) {
            final String frame = partial.toString();
            partial.setLength(0);
            try {
                handle(frame);
            } catch (SourceConnectException e) {
                fail(e);
            }
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        fail(new SourceConnectException("WebSocket closed by node: " + statusCode + " " + reason));
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        fail(new SourceConnectException("WebSocket error: " + error.getMessage(), error));
    }

    /**
     * Routes one inbound frame: a reply to a pending call, the subscription ack, or a head notification.
     *
     * @throws SourceConnectException the frame is unparseable or the subscription was refused
     */
    void handle(String frame) throws SourceConnectException {
        final JsonNode msg;
        try {
            msg = HttpJsonRpcClient.MAPPER.readTree(frame);
        } catch (IOException e) {
            throw new SourceConnectException("Unparseable subscription frame", e);
        }

        final JsonNode id = msg.get("id");
        if (id != null && !id.isNull()) {
            final long replyId = id.asLong();
            if (replyId == SUBSCRIBE_ID) {
                log.debug("Source '{}' subscription id {}", sourceId, HttpJsonRpcClient.resultOf("subscribe", msg));
                return;
            }
            final PendingCall call = pending.get(replyId);
            if (call == null) {
                log.debug("Source '{}' dropped late reply {}", sourceId, replyId);
                return;
            }
            try {
                call.reply().complete(HttpJsonRpcClient.resultOf(call.method(), msg));
            } catch (SourceConnectException e) {
                call.reply().completeExceptionally(e);
            }
            return;
        }

        final JsonNode head = msg.path("params").path("result");
        if (head.isObject()) {
            offerHead(dialect.headHeight(head));
        }
    }

    void offerHead(long height) {
        knownHead.accumulateAndGet(height, Math::max);
        headArrived.release();
    }

    long knownHead() {
        return knownHead.get();
    }

    private void fail(SourceConnectException e) {
        if (failure == null) {
            failure = e;
            log.warn("Source '{}' subscription lost: {}", sourceId, e.getMessage());
        }
        abandonPending(e);
    }

    private void abandonPending(SourceConnectException cause) {
        for (PendingCall call : pending.values()) {
            call.reply().completeExceptionally(cause);
        }
        headArrived.release();
    }

    // Test hook: frames go to {@code outbound} instead of a socket
    static SubscriptionConnection detached(String sourceId,
                                           RpcDialect dialect,
                                           OptionalLong fromHeight,
                                           int maxBlocksPerStep,
                                           Outbound outbound) {
        final SubscriptionConnection conn =
                new SubscriptionConnection(sourceId, dialect, fromHeight, maxBlocksPerStep, Duration.ofSeconds(2));
        conn.outbound = outbound;
        return conn;
    }
}
