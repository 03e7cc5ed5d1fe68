/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.jsonrpc;

import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.core.SourceConnection;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import com.intuitivedesigns.chainkernel.model.RawRecord;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Polls a node for new heights and yields one record per transaction, in (height, index) order.
 *
 * <p>Owned by a single worker thread; not thread-safe.</p>
 */
final class PollingConnection implements SourceConnection {

    private final RpcDialect dialect;
    private final RpcClient rpc;
    private final long pollIntervalNanos;
    private final BlockWalker walker;

    private long nextPollAt = System.nanoTime();

    PollingConnection(String sourceId,
                      RpcDialect dialect,
                      RpcClient rpc,
                      OptionalLong fromHeight,
                      Duration pollInterval,
                      int maxBlocksPerPoll) {
        this.dialect = dialect;
        this.rpc = rpc;
        this.pollIntervalNanos = pollInterval.toNanos();
        this.walker = new BlockWalker(sourceId, dialect, rpc, fromHeight, maxBlocksPerPoll);
    }

    @Override
    public RawRecord next(Duration timeout) throws SourceConnectException, InterruptedException {
        if (walker.hasBuffered()) {
            return walker.poll();
        }

        long now = System.nanoTime();
        if (now - nextPollAt >= 0) {
            final boolean caughtUp = poll();
            // Keep draining the backlog without waiting while behind the head
            nextPollAt = caughtUp ? System.nanoTime() + pollIntervalNanos : System.nanoTime();
            if (walker.hasBuffered()) {
                return walker.poll();
            }
            now = System.nanoTime();
        }

        final long waitNanos = Math.min(timeout.toNanos(), nextPollAt - now);
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
        return null;
    }

    /**
     * Reads up to {@code maxBlocksPerPoll} heights towards the current head.
     *
     * @return true once the chain head has been reached
     */
    boolean poll() throws SourceConnectException, InterruptedException {
        return walker.walkTo(dialect.latestHeight(rpc));
    }

    long nextHeight() {
        return walker.nextHeight();
    }

    @Override
    public void close() {
        walker.clear();
    }
}
