/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void testDoublesWithoutJitter() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(10), 0.0);

        assertEquals(100, policy.delay(1).toMillis());
        assertEquals(200, policy.delay(2).toMillis());
        assertEquals(400, policy.delay(3).toMillis());
        assertEquals(800, policy.delay(4).toMillis());
    }

    @Test
    void testCappedAtMax() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(30), 0.2);

        for (int attempt = 1; attempt < 100; attempt++) {
            assertTrue(policy.delay(attempt).compareTo(Duration.ofSeconds(30)) <= 0, "attempt " + attempt);
        }
        assertEquals(Duration.ofSeconds(30), policy.max());
    }

    @Test
    void testJitterStaysWithinBounds() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(1000), Duration.ofSeconds(60), 0.2);

        for (int i = 0; i < 500; i++) {
            long ms = policy.delay(1).toMillis();
            assertTrue(ms >= 800 && ms <= 1200, "delay out of range: " + ms);
        }
    }

    @Test
    void testDefaultPolicy() {
        BackoffPolicy policy = BackoffPolicy.defaultPolicy();
        long first = policy.delay(1).toMillis();
        assertTrue(first >= 400 && first <= 600);
        assertEquals(Duration.ofSeconds(30), policy.max());
    }
}
