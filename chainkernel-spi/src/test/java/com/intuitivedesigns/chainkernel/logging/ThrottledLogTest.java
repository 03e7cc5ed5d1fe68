/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.logging;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ThrottledLogTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private final ThrottledLog log = new ThrottledLog(
            LoggerFactory.getLogger(ThrottledLogTest.class), Level.WARN, 1_000L, now::get);

    @Test
    void testFirstFailureIsWritten() {
        assertTrue(log.report("first", new IllegalStateException("boom")));
        assertEquals(1, log.emittedCount());
        assertEquals(0, log.pendingSuppressed());
    }

    @Test
    void testRepeatsInsideIntervalAreSuppressed() {
        assertTrue(log.report("ctx", new RuntimeException("a")));
        now.addAndGet(200);
        assertFalse(log.report("ctx", new RuntimeException("b")));
        assertFalse(log.report("ctx", new RuntimeException("c")));
        assertEquals(2, log.pendingSuppressed());

        now.addAndGet(1_000);
        assertTrue(log.report("ctx", new RuntimeException("d")));
        assertEquals(0, log.pendingSuppressed());
        assertEquals(2, log.emittedCount());
    }

    @Test
    void testNullCauseAndMessageAreTolerated() {
        assertTrue(log.report("no cause", null));
        now.addAndGet(5_000);
        assertTrue(log.report("no message", new NullPointerException()));
    }
}
