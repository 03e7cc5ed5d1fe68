/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.RegistryException;
import com.intuitivedesigns.chainkernel.model.RegistrySnapshot;

/**
 * Read-only client over the watchable source registry. Performs no writes.
 */
public interface ConfigStore extends AutoCloseable {

    /**
     * Full snapshot of the current source definitions.
     */
    RegistrySnapshot list() throws RegistryException;

    /**
     * Opens a change stream resuming right after the given snapshot cursor.
     * Changes are never dropped silently: a transport failure surfaces as {@link RegistryException}
     * from {@link RegistryWatch#next}, after which the caller re-lists.
     */
    RegistryWatch watch(String cursor) throws RegistryException;

    /**
     * Bootstrap reachability check. Throws when the registry cannot be reached at all.
     */
    default void verify() throws RegistryException {
        list();
    }

    @Override
    default void close() {}
}
