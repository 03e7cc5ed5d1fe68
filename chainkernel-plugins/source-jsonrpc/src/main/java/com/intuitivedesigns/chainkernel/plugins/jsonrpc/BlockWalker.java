/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.chainkernel.core.RpcClient;
import com.intuitivedesigns.chainkernel.core.RpcDialect;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import com.intuitivedesigns.chainkernel.model.ChainPosition;
import com.intuitivedesigns.chainkernel.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.OptionalLong;

/**
 * Walks heights in order towards a known head and buffers one transaction record per
 * {@code (height, index)}. Shared by the polling and subscription transports so both emit the
 * same positions for the same chain data.
 *
 * <p>Owned by a single worker thread; not thread-safe.</p>
 */
final class BlockWalker {

    private static final Logger log = LoggerFactory.getLogger(BlockWalker.class);

    private final String sourceId;
    private final RpcDialect dialect;
    private final RpcClient rpc;
    private final int maxBlocksPerStep;
    private final ArrayDeque<RawRecord> buffer = new ArrayDeque<>();

    private long nextHeight;
    private boolean positioned;

    BlockWalker(String sourceId, RpcDialect dialect, RpcClient rpc, OptionalLong fromHeight, int maxBlocksPerStep) {
        this.sourceId = sourceId;
        this.dialect = dialect;
        this.rpc = rpc;
        this.maxBlocksPerStep = Math.max(1, maxBlocksPerStep);
        if (fromHeight.isPresent()) {
            this.nextHeight = fromHeight.getAsLong();
            this.positioned = true;
        }
    }

    /**
     * Fetches up to {@code maxBlocksPerStep} heights, starting at the resume height, or at
     * {@code head} itself when no resume height was given.
     *
     * @return true once {@code head} has been read
     */
    boolean walkTo(long head) throws SourceConnectException, InterruptedException {
        if (!positioned) {
            nextHeight = head;
            positioned = true;
            log.info("Source '{}' starting at chain head {}", sourceId, head);
        }
        if (nextHeight > head) {
            return true;
        }

        final long last = Math.min(head, nextHeight + maxBlocksPerStep - 1);
        for (long h = nextHeight; h <= last; h++) {
            final List<JsonNode> txs = dialect.transactions(rpc, h);
            final Instant receivedAt = Instant.now();
            for (int i = 0; i < txs.size(); i++) {
                buffer.add(new RawRecord(sourceId, dialect.chainType(), ChainPosition.of(h, i),
                        RawRecord.KIND_TRANSACTION, txs.get(i), receivedAt));
            }
            nextHeight = h + 1;
        }
        return last == head;
    }

    boolean isBehind(long head) {
        return !positioned || nextHeight <= head;
    }

    RawRecord poll() {
        return buffer.poll();
    }

    boolean hasBuffered() {
        return !buffer.isEmpty();
    }

    long nextHeight() {
        return nextHeight;
    }

    void clear() {
        buffer.clear();
    }
}
