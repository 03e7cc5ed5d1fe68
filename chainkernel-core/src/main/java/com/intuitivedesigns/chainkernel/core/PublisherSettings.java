/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.config.KernelConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Publisher tuning.
 *
 * @param bufferCapacity events held locally before {@code publish} blocks
 * @param batchSize      events handed to the bus per delivery round
 * @param retryBackoff   delay between redelivery attempts while the bus is unreachable
 * @param staleness      age after which undelivered events mark their source degraded
 * @param sendTimeout    max wait for one bus acknowledgement before it counts as a failure
 */
public record PublisherSettings(int bufferCapacity,
                                int batchSize,
                                BackoffPolicy retryBackoff,
                                Duration staleness,
                                Duration sendTimeout) {

    public static final String KEY_BUFFER_CAPACITY = "publisher.buffer.capacity";
    public static final String KEY_BATCH_SIZE = "publisher.batch.size";
    public static final String KEY_RETRY_INITIAL_MS = "publisher.retry.initial.ms";
    public static final String KEY_RETRY_MAX_MS = "publisher.retry.max.ms";
    public static final String KEY_STALENESS_MS = "publisher.staleness.ms";
    public static final String KEY_SEND_TIMEOUT_MS = "publisher.send.timeout.ms";

    public PublisherSettings {
        if (bufferCapacity <= 0) throw new IllegalArgumentException(KEY_BUFFER_CAPACITY + " must be > 0");
        if (batchSize <= 0) throw new IllegalArgumentException(KEY_BATCH_SIZE + " must be > 0");
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        Objects.requireNonNull(staleness, "staleness");
        Objects.requireNonNull(sendTimeout, "sendTimeout");
    }

    public static PublisherSettings from(KernelConfig config) {
        return new PublisherSettings(
                config.getInt(KEY_BUFFER_CAPACITY, 10_000),
                config.getInt(KEY_BATCH_SIZE, 500),
                new BackoffPolicy(
                        config.getMillis(KEY_RETRY_INITIAL_MS, 200L),
                        config.getMillis(KEY_RETRY_MAX_MS, 10_000L),
                        0.2),
                config.getMillis(KEY_STALENESS_MS, 60_000L),
                config.getMillis(KEY_SEND_TIMEOUT_MS, 30_000L)
        );
    }
}
