/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import com.intuitivedesigns.chainkernel.model.RawRecord;

import java.time.Duration;

/**
 * One live connection to one source endpoint, yielding raw records in position order.
 */
public interface SourceConnection extends AutoCloseable {

    /**
     * Blocks up to {@code timeout} for the next record.
     *
     * @return the record, or {@code null} if nothing arrived in time
     * @throws SourceConnectException on a connection-level failure; the connection is unusable afterwards
     */
    RawRecord next(Duration timeout) throws SourceConnectException, InterruptedException;

    @Override
    void close();
}
