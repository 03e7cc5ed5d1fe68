/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class PollingConnectionTest {

    /** One transaction per height except {@code empty}, head is mutable. */
    private static final class CountingDialect implements RpcDialect {
        volatile long head;
        final long empty;
        final List<Long> fetched = new ArrayList<>();

        CountingDialect(long head, long empty) {
            this.head = head;
            this.empty = empty;
        }

        @Override
        public String chainType() {
            return "test";
        }

        @Override
        public long latestHeight(RpcClient rpc) {
            return head;
        }

        @Override
        public List<JsonNode> transactions(RpcClient rpc, long height) {
            fetched.add(height);
            return height == empty ? List.of() : List.of(JsonNodeFactory.instance.numberNode(height));
        }
    }

    private static final RpcClient UNUSED = (method, params) -> {
        throw new AssertionError("dialect stub does not call the client");
    };

    @Test
    void testCatchUpIsBoundedPerPoll() throws Exception {
        CountingDialect dialect = new CountingDialect(10, -1);
        PollingConnection conn = new PollingConnection("s", dialect, UNUSED, OptionalLong.of(1), Duration.ofSeconds(60), 3);

        assertFalse(conn.poll());
        assertEquals(List.of(1L, 2L, 3L), dialect.fetched);
        assertEquals(4, conn.nextHeight());
    }

    @Test
    void testBacklogDrainsWithoutWaitingForInterval() throws Exception {
        CountingDialect dialect = new CountingDialect(6, 4);
        PollingConnection conn = new PollingConnection("s", dialect, UNUSED, OptionalLong.of(1), Duration.ofSeconds(60), 2);

        List<Long> heights = new ArrayList<>();
        for (int i = 0; i < 20 && heights.size() < 5; i++) {
            RawRecord r = conn.next(Duration.ofMillis(10));
            if (r != null) heights.add(r.position().height());
        }

        // Height 4 has no transactions (e.g. a skipped slot)
        assertEquals(List.of(1L, 2L, 3L, 5L, 6L), heights);
    }

    @Test
    void testIdleAtHeadReturnsNull() throws Exception {
        CountingDialect dialect = new CountingDialect(2, -1);
        PollingConnection conn = new PollingConnection("s", dialect, UNUSED, OptionalLong.of(3), Duration.ofMillis(5), 5);

        assertNull(conn.next(Duration.ofMillis(10)));
        assertTrue(dialect.fetched.isEmpty());

        dialect.head = 3;
        Thread.sleep(10);
        assertEquals(3L, conn.next(Duration.ofMillis(10)).position().height());
    }
}
