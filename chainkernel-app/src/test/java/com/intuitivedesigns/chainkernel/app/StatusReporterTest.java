/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.app;

import com.intuitivedesigns.chainkernel.model.WorkerState;
import com.intuitivedesigns.chainkernel.model.WorkerStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatusReporterTest {

    private static WorkerState state(String id, WorkerStatus status, boolean degraded) {
        return new WorkerState(id, status, null, 0, Instant.EPOCH, degraded);
    }

    @Test
    void testFormatCountsSourcesPerStatus() {
        Map<String, WorkerState> states = new LinkedHashMap<>();
        states.put("a", state("a", WorkerStatus.RUNNING, false));
        states.put("b", state("b", WorkerStatus.RUNNING, true));
        states.put("c", state("c", WorkerStatus.FAILED, false));

        String line = StatusReporter.format(30, 1234.0, 7, 2, states);

        assertTrue(line.startsWith("AVG 30s | PUBLISHED: 1,234 eps | BUFFERED: 7 | RETRIES: 2 | SOURCES: 3"), line);
        assertTrue(line.contains("running=2"), line);
        assertTrue(line.contains("failed=1"), line);
        assertFalse(line.contains("backoff="), line);
        assertTrue(line.endsWith("| DEGRADED: 1"), line);
    }

    @Test
    void testFormatWithNoSources() {
        String line = StatusReporter.format(5, 0.0, 0, 0, Map.of());

        assertEquals("AVG 5s | PUBLISHED: 0 eps | BUFFERED: 0 | RETRIES: 0 | SOURCES: 0", line);
    }
}
