/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.chainkernel.model.WorkerState;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Read-only JSON view of the per-source health snapshot.
 * <ul>
 *   <li>{@code GET /sources}: every source, ordered by id</li>
 *   <li>{@code GET /sources/{id}}: one source, 404 if unknown</li>
 * </ul>
 */
public final class HealthSnapshotServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthSnapshotServer.class);

    public static final String KEY_PORT = "health.http.port";
    private static final String CONTEXT = "/sources";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpServer server;
    private final ExecutorService executor;
    private final Supplier<Map<String, WorkerState>> snapshot;

    private HealthSnapshotServer(HttpServer server, ExecutorService executor, Supplier<Map<String, WorkerState>> snapshot) {
        this.server = server;
        this.executor = executor;
        this.snapshot = snapshot;
    }

    /**
     * Binds on {@code port} (0 picks a free one) and starts serving.
     */
    public static HealthSnapshotServer start(int port, Supplier<Map<String, WorkerState>> snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        final HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ck-health-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        final HealthSnapshotServer health = new HealthSnapshotServer(server, executor, snapshot);
        server.createContext(CONTEXT, health::handle);
        server.start();
        log.info("Health endpoint listening on :{}{}", health.port(), CONTEXT);
        return health;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                send(exchange, 405, error("method not allowed"));
                return;
            }
            final String path = exchange.getRequestURI().getPath();
            final Map<String, WorkerState> states = snapshot.get();

            if (path.equals(CONTEXT) || path.equals(CONTEXT + "/")) {
                final ArrayNode arr = MAPPER.createArrayNode();
                new TreeMap<>(states).values().forEach(s -> arr.add(toJson(s)));
                send(exchange, 200, arr);
                return;
            }

            final String id = path.substring(CONTEXT.length() + 1);
            final WorkerState state = states.get(id);
            if (state == null) {
                send(exchange, 404, error("unknown source: " + id));
            } else {
                send(exchange, 200, toJson(state));
            }
        } catch (Exception e) {
            log.warn("Health request failed: {}", e.toString());
            try {
                exchange.sendResponseHeaders(500, -1);
            } catch (IOException | RuntimeException sendFailure) {
                log.debug("Could not send 500 for health request: {}", sendFailure.toString());
            }
        } finally {
            exchange.close();
        }
    }

    static ObjectNode toJson(WorkerState state) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("source_id", state.sourceId());
        node.put("status", state.status().label());
        node.put("restart_count", state.restartCount());
        node.put("last_error", state.lastError());
        node.put("last_heartbeat", state.lastHeartbeat() == null ? null : state.lastHeartbeat().toString());
        node.put("degraded", state.degraded());
        return node;
    }

    private static ObjectNode error(String message) {
        return MAPPER.createObjectNode().put("error", message);
    }

    private static void send(HttpExchange exchange, int status, Object body) throws IOException {
        final byte[] bytes = MAPPER.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
