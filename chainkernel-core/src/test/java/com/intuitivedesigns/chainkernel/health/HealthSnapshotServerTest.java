/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.chainkernel.model.WorkerState;
import com.intuitivedesigns.chainkernel.model.WorkerStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class HealthSnapshotServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private HealthSnapshotServer server;

    @BeforeEach
    void setUp() throws Exception {
        Map<String, WorkerState> states = new LinkedHashMap<>();
        states.put("zeta", new WorkerState("zeta", WorkerStatus.FAILED, "No decoder registered for chain type 'unknown-vm'", 0, null, false));
        states.put("alpha", new WorkerState("alpha", WorkerStatus.RUNNING, null, 2, Instant.parse("2025-01-01T00:00:00Z"), true));
        server = HealthSnapshotServer.start(0, () -> states);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path)).GET().build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testListsAllSourcesOrderedById() throws Exception {
        HttpResponse<String> resp = get("/sources");

        assertEquals(200, resp.statusCode());
        JsonNode body = mapper.readTree(resp.body());
        assertEquals(2, body.size());
        assertEquals("alpha", body.get(0).get("source_id").asText());
        assertEquals("running", body.get(0).get("status").asText());
        assertEquals(2, body.get(0).get("restart_count").asInt());
        assertTrue(body.get(0).get("degraded").asBoolean());
        assertEquals("failed", body.get(1).get("status").asText());
    }

    @Test
    void testSingleSource() throws Exception {
        HttpResponse<String> resp = get("/sources/zeta");

        assertEquals(200, resp.statusCode());
        JsonNode body = mapper.readTree(resp.body());
        assertTrue(body.get("last_error").asText().contains("unknown-vm"));
        assertTrue(body.get("last_heartbeat").isNull());
    }

    @Test
    void testUnknownSourceIs404() throws Exception {
        assertEquals(404, get("/sources/missing").statusCode());
    }

    @Test
    void testOnlyGetAllowed() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/sources"))
                .POST(HttpRequest.BodyPublishers.ofString("{}")).build();
        assertEquals(405, client.send(req, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void testSnapshotFailureAnswers500AndKeepsServing() throws Exception {
        AtomicBoolean broken = new AtomicBoolean(true);
        try (HealthSnapshotServer flaky = HealthSnapshotServer.start(0, () -> {
            if (broken.get()) {
                throw new IllegalStateException("supervisor stopped");
            }
            return Map.of();
        })) {
            URI uri = URI.create("http://localhost:" + flaky.port() + "/sources");
            HttpRequest req = HttpRequest.newBuilder(uri).GET().build();

            assertEquals(500, client.send(req, HttpResponse.BodyHandlers.ofString()).statusCode());

            broken.set(false);
            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
            assertEquals(200, resp.statusCode());
            assertEquals(0, mapper.readTree(resp.body()).size());
        }
    }
}
