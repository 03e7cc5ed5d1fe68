/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkerStateTest {

    @Test
    void testTransitionsReturnNewInstances() {
        WorkerState initial = WorkerState.initial("s");
        WorkerState failed = initial.withRestart().withRestart().withError(WorkerStatus.FAILED, "boom");

        assertEquals(WorkerStatus.STARTING, initial.status());
        assertEquals(0, initial.restartCount());
        assertEquals(WorkerStatus.FAILED, failed.status());
        assertEquals(2, failed.restartCount());
        assertEquals("boom", failed.lastError());
        assertEquals(0, failed.resetRestarts().restartCount());
        assertEquals("failed", failed.status().label());
    }

    @Test
    void testPositionOrdering() {
        assertTrue(ChainPosition.of(10, 1).isAfter(ChainPosition.of(10, 0)));
        assertTrue(ChainPosition.of(11, 0).isAfter(ChainPosition.of(10, 99)));
        assertFalse(ChainPosition.of(10, 0).isAfter(ChainPosition.of(10, 0)));
        assertTrue(ChainPosition.of(0, 0).isAfter(null));
        assertEquals("s:10:2", NormalizedEvent.dedupKey("s", ChainPosition.of(10, 2)));
    }
}
