/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.RegistryException;
import com.intuitivedesigns.chainkernel.model.RegistryChange;

import java.time.Duration;

/**
 * Lazy change sequence over the registry. Closing it is the cancellation.
 */
public interface RegistryWatch extends AutoCloseable {

    /**
     * Blocks up to {@code timeout} for the next change.
     *
     * @return the change, or {@code null} if none arrived in time
     */
    RegistryChange next(Duration timeout) throws RegistryException, InterruptedException;

    @Override
    void close();
}
