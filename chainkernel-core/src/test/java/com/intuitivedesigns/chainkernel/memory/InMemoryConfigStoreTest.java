/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.memory;

import com.intuitivedesigns.chainkernel.core.RegistryWatch;
import com.intuitivedesigns.chainkernel.error.RegistryException;
import com.intuitivedesigns.chainkernel.model.RegistryChange;
import com.intuitivedesigns.chainkernel.model.RegistrySnapshot;
import com.intuitivedesigns.chainkernel.model.SourceConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConfigStoreTest {

    private static final Duration SHORT = Duration.ofMillis(50);

    @Test
    void testListSeparatesValidAndInvalid() throws Exception {
        InMemoryConfigStore store = new InMemoryConfigStore();
        store.put(SourceConfig.of("a", "evm", "http://a", true));
        store.putRaw("b", "{broken");

        RegistrySnapshot snap = store.list();

        assertEquals(1, snap.configs().size());
        assertEquals("a", snap.configs().get(0).id());
        assertTrue(snap.invalid().containsKey("b"));
        assertEquals("2", snap.cursor());
    }

    @Test
    void testWatchResumesAfterCursor() throws Exception {
        InMemoryConfigStore store = new InMemoryConfigStore();
        store.put(SourceConfig.of("a", "evm", "http://a", true));
        RegistrySnapshot snap = store.list();

        try (RegistryWatch watch = store.watch(snap.cursor())) {
            assertNull(watch.next(SHORT));

            store.put(SourceConfig.of("b", "evm", "http://b", true));
            store.delete("a");
            store.putRaw("c", "[]");

            RegistryChange put = watch.next(SHORT);
            assertEquals(RegistryChange.Type.PUT, put.type());
            assertEquals("b", put.sourceId());

            RegistryChange delete = watch.next(SHORT);
            assertEquals(RegistryChange.Type.DELETE, delete.type());
            assertEquals("a", delete.sourceId());

            assertEquals(RegistryChange.Type.INVALID, watch.next(SHORT).type());
            assertNull(watch.next(SHORT));
        }
    }

    @Test
    void testDeleteOfUnknownIdIsNotAChange() throws Exception {
        InMemoryConfigStore store = new InMemoryConfigStore();
        store.delete("nope");
        assertEquals("0", store.list().cursor());
    }

    @Test
    void testBrokenWatchSurfacesError() throws Exception {
        InMemoryConfigStore store = new InMemoryConfigStore();
        RegistryWatch watch = store.watch(store.list().cursor());

        store.breakWatches();

        assertThrows(RegistryException.class, () -> watch.next(SHORT));
        // A fresh watch works again
        assertNull(store.watch(store.list().cursor()).next(SHORT));
    }

    @Test
    void testFailLists() throws Exception {
        InMemoryConfigStore store = new InMemoryConfigStore();
        store.failLists(2);

        assertThrows(RegistryException.class, store::list);
        assertThrows(RegistryException.class, store::verify);
        assertNotNull(store.list());
    }

    @Test
    void testClosedWatchReturnsNull() throws Exception {
        InMemoryConfigStore store = new InMemoryConfigStore();
        RegistryWatch watch = store.watch("0");
        watch.close();
        store.put(SourceConfig.of("a", "evm", "http://a", true));

        assertNull(watch.next(SHORT));
    }
}
