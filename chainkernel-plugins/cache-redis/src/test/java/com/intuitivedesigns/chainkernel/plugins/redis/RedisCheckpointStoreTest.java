/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.redis;

import com.intuitivedesigns.chainkernel.error.CacheException;
import com.intuitivedesigns.chainkernel.model.ChainPosition;
import com.intuitivedesigns.chainkernel.model.Checkpoint;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RedisCheckpointStoreTest {

    @Test
    void testValueFormat() throws Exception {
        Checkpoint cp = new Checkpoint("sol-1", ChainPosition.of(250_000_000L, 17), Instant.ofEpochMilli(1_700_000_000_000L));

        String raw = RedisCheckpointStore.encode(cp);

        assertEquals("{\"height\":250000000,\"index\":17,\"updated_at\":1700000000000}", raw);
        assertEquals(cp, RedisCheckpointStore.decode("sol-1", raw));
    }

    @Test
    void testCorruptValue() {
        assertThrows(CacheException.class, () -> RedisCheckpointStore.decode("x", "not json"));
        assertThrows(CacheException.class, () -> RedisCheckpointStore.decode("x", "{\"index\":1}"));
        assertThrows(CacheException.class, () -> RedisCheckpointStore.decode("x", "{\"height\":-1,\"index\":0}"));
    }
}
