/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.memory;

import com.intuitivedesigns.chainkernel.core.CheckpointStore;
import com.intuitivedesigns.chainkernel.model.Checkpoint;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoints held in process memory; lost on restart.
 */
public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<Checkpoint> load(String sourceId) {
        return Optional.ofNullable(checkpoints.get(sourceId));
    }

    @Override
    public void save(Checkpoint checkpoint) {
        checkpoints.put(checkpoint.sourceId(), checkpoint);
    }

    @Override
    public void delete(String sourceId) {
        checkpoints.remove(sourceId);
    }

    public int size() {
        return checkpoints.size();
    }
}
