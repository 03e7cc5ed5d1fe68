/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.memory;

import com.intuitivedesigns.chainkernel.core.ConfigStore;
import com.intuitivedesigns.chainkernel.core.RegistryWatch;
import com.intuitivedesigns.chainkernel.error.ConfigException;
import com.intuitivedesigns.chainkernel.error.RegistryException;
import com.intuitivedesigns.chainkernel.model.RegistryChange;
import com.intuitivedesigns.chainkernel.model.RegistrySnapshot;
import com.intuitivedesigns.chainkernel.model.SourceConfig;
import com.intuitivedesigns.chainkernel.model.SourceConfigCodec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local registry: single-node runs and tests.
 *
 * <p>Keeps the raw JSON per source plus an append-only change log; a snapshot cursor is the log
 * length at listing time. {@link #breakWatches()} and {@link #failLists(int)} simulate a transport
 * outage.</p>
 */
public final class InMemoryConfigStore implements ConfigStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final Map<String, String> entries = new LinkedHashMap<>();
    private final List<RegistryChange> changes = new ArrayList<>();
    private long epoch;
    private int failingLists;

    public void put(SourceConfig config) {
        putRaw(config.id(), SourceConfigCodec.encode(config));
    }

    /**
     * Writes a raw registry value, which need not parse.
     */
    public void putRaw(String sourceId, String json) {
        RegistryChange change;
        try {
            change = RegistryChange.put(SourceConfigCodec.decode(sourceId, json));
        } catch (ConfigException e) {
            change = RegistryChange.invalid(sourceId, e.getMessage());
        }
        lock.lock();
        try {
            entries.put(sourceId, json);
            changes.add(change);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void delete(String sourceId) {
        lock.lock();
        try {
            if (entries.remove(sourceId) != null) {
                changes.add(RegistryChange.delete(sourceId));
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails every open watch with a {@link RegistryException}.
     */
    public void breakWatches() {
        lock.lock();
        try {
            epoch++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes the next {@code count} calls to {@link #list()} fail.
     */
    public void failLists(int count) {
        lock.lock();
        try {
            failingLists = count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RegistrySnapshot list() throws RegistryException {
        lock.lock();
        try {
            if (failingLists > 0) {
                failingLists--;
                throw new RegistryException("registry unavailable");
            }
            final List<SourceConfig> configs = new ArrayList<>();
            final Map<String, String> invalid = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : entries.entrySet()) {
                try {
                    configs.add(SourceConfigCodec.decode(e.getKey(), e.getValue()));
                } catch (ConfigException ex) {
                    invalid.put(e.getKey(), ex.getMessage());
                }
            }
            return new RegistrySnapshot(configs, invalid, Integer.toString(changes.size()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RegistryWatch watch(String cursor) throws RegistryException {
        final int from;
        try {
            from = Integer.parseInt(cursor);
        } catch (NumberFormatException e) {
            throw new RegistryException("Bad cursor: " + cursor);
        }
        lock.lock();
        try {
            return new Watch(from, epoch);
        } finally {
            lock.unlock();
        }
    }

    private final class Watch implements RegistryWatch {
        private int position;
        private final long openedEpoch;
        private boolean closed;

        Watch(int position, long openedEpoch) {
            this.position = position;
            this.openedEpoch = openedEpoch;
        }

        @Override
        public RegistryChange next(Duration timeout) throws RegistryException, InterruptedException {
            long nanos = timeout.toNanos();
            lock.lock();
            try {
                while (true) {
                    if (closed) return null;
                    if (epoch != openedEpoch) {
                        throw new RegistryException("registry connection lost");
                    }
                    if (position < changes.size()) {
                        return changes.get(position++);
                    }
                    if (nanos <= 0) return null;
                    nanos = changed.awaitNanos(nanos);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                closed = true;
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

}
