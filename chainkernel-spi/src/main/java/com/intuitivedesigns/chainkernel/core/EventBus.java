/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.error.PublishException;
import com.intuitivedesigns.chainkernel.model.DeliveryReceipt;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Durable, per-key ordered log the normalized events are written to.
 * Each message carries the event's dedup key as its idempotency token.
 */
public interface EventBus extends AutoCloseable {

    /**
     * Starts sending one event. Calls for the same source must be delivered in call order.
     * The future completes exceptionally on a delivery failure; it is never left hanging forever.
     */
    CompletableFuture<DeliveryReceipt> send(NormalizedEvent event);

    void flush();

    /**
     * Bootstrap reachability check.
     */
    void verify() throws PublishException;

    @Override
    void close();
}
