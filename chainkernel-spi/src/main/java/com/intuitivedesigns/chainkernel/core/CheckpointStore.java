/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.CacheException;
import com.intuitivedesigns.chainkernel.model.Checkpoint;

import java.util.Optional;

/**
 * Durable per-source cursors.
 */
public interface CheckpointStore extends AutoCloseable {

    Optional<Checkpoint> load(String sourceId) throws CacheException;

    void save(Checkpoint checkpoint) throws CacheException;

    void delete(String sourceId) throws CacheException;

    default void verify() throws CacheException {}

    @Override
    default void close() {}
}
