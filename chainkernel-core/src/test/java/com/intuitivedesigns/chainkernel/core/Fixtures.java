/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.error.DecodeException;
import com.intuitivedesigns.chainkernel.error.PublishException;
import com.intuitivedesigns.chainkernel.error.SourceConnectException;
import com.intuitivedesigns.chainkernel.model.ChainPosition;
import com.intuitivedesigns.chainkernel.model.DeliveryReceipt;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.model.RawRecord;
import com.intuitivedesigns.chainkernel.model.SourceConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Fakes shared by the engine tests. Chain type "test" decodes {@code {"value": n}} payloads and
 * rejects payloads carrying {@code "bad": true}.
 */
final class Fixtures {

    static final String CHAIN = "test";
    static final String FAILING_ENDPOINT = "fail://node";

    private Fixtures() {}

    static DecoderRegistry decoders() {
        return DecoderRegistry.builder().register(new TestDecoder()).build();
    }

    static WorkerSettings workerSettings() {
        return WorkerSettings.from(KernelConfig.of(Map.of(
                WorkerSettings.KEY_BACKOFF_INITIAL_MS, "20",
                WorkerSettings.KEY_BACKOFF_MAX_MS, "50",
                WorkerSettings.KEY_CHECKPOINT_EVERY_RECORDS, "2",
                WorkerSettings.KEY_CHECKPOINT_EVERY_MS, "50",
                WorkerSettings.KEY_CHECKPOINT_FLUSH_TIMEOUT_MS, "200",
                WorkerSettings.KEY_POLL_TIMEOUT_MS, "10",
                WorkerSettings.KEY_HEARTBEAT_MS, "50"
        )));
    }

    static SupervisorSettings supervisorSettings(int maxRestarts) {
        return SupervisorSettings.from(KernelConfig.of(Map.of(
                SupervisorSettings.KEY_CRASHLOOP_MAX, Integer.toString(maxRestarts),
                SupervisorSettings.KEY_CRASHLOOP_WINDOW_MS, "60000",
                SupervisorSettings.KEY_STOP_TIMEOUT_MS, "1000",
                SupervisorSettings.KEY_SHUTDOWN_TIMEOUT_MS, "2000",
                SupervisorSettings.KEY_RESTART_INITIAL_MS, "20",
                SupervisorSettings.KEY_RESTART_MAX_MS, "50",
                SupervisorSettings.KEY_REGISTRY_RETRY_INITIAL_MS, "20",
                SupervisorSettings.KEY_REGISTRY_RETRY_MAX_MS, "50",
                SupervisorSettings.KEY_WATCH_POLL_MS, "20"
        )));
    }

    static PublisherSettings publisherSettings(int capacity, long stalenessMs) {
        return new PublisherSettings(capacity, 10,
                new BackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(20), 0.0),
                Duration.ofMillis(stalenessMs),
                Duration.ofSeconds(1));
    }

    static SourceConfig source(String id) {
        return SourceConfig.of(id, CHAIN, "http://" + id, true);
    }

    static NormalizedEvent event(String sourceId, long height) {
        final ChainPosition pos = ChainPosition.of(height, 0);
        return new NormalizedEvent(sourceId, CHAIN, pos, "transfer", Map.of("value", height),
                NormalizedEvent.dedupKey(sourceId, pos), Instant.EPOCH);
    }

    static boolean await(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        final long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) return true;
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    static final class TestDecoder implements ChainDecoder {
        @Override
        public String chainType() {
            return CHAIN;
        }

        @Override
        public NormalizedEvent decode(RawRecord record) throws DecodeException {
            if (record.payload().path("bad").asBoolean(false)) {
                throw new DecodeException("malformed record at " + record.position());
            }
            return NormalizedEvent.from(record, "transfer", Map.of("value", record.payload().path("value").asLong()));
        }
    }

    /**
     * Serves heights {@code from..maxHeight} (from = requested height, else 1), one record per height,
     * then idles. Endpoint {@link #FAILING_ENDPOINT} refuses every connection, endpoints in
     * {@link #refusing} only while they are listed.
     */
    static final class ScriptedConnections implements ConnectionFactory {
        private final long maxHeight;
        private final Set<Long> badHeights;
        final AtomicInteger opens = new AtomicInteger();
        final Set<String> refusing = ConcurrentHashMap.newKeySet();
        final List<OptionalLong> requestedHeights = new CopyOnWriteArrayList<>();

        ScriptedConnections(long maxHeight, Set<Long> badHeights) {
            this.maxHeight = maxHeight;
            this.badHeights = badHeights;
        }

        @Override
        public SourceConnection open(SourceConfig config, RpcDialect dialect, OptionalLong fromHeight)
                throws SourceConnectException {
            opens.incrementAndGet();
            requestedHeights.add(fromHeight);
            if (FAILING_ENDPOINT.equals(config.endpoint()) || refusing.contains(config.endpoint())) {
                throw new SourceConnectException("connection refused: " + config.endpoint());
            }
            final long start = fromHeight.orElse(1L);
            return new SourceConnection() {
                long next = start;

                @Override
                public RawRecord next(Duration timeout) throws InterruptedException {
                    if (next > maxHeight) {
                        Thread.sleep(timeout.toMillis());
                        return null;
                    }
                    final long height = next++;
                    final ObjectNode payload = JsonNodeFactory.instance.objectNode().put("value", height);
                    if (badHeights.contains(height)) payload.put("bad", true);
                    return new RawRecord(config.id(), config.chainType(), ChainPosition.of(height, 0),
                            RawRecord.KIND_TRANSACTION, payload, Instant.now());
                }

                @Override
                public void close() {
                }
            };
        }
    }

    static final class RecordingBus implements EventBus {
        final List<NormalizedEvent> sent = new CopyOnWriteArrayList<>();
        final AtomicInteger attempts = new AtomicInteger();
        volatile boolean failing;

        @Override
        public CompletableFuture<DeliveryReceipt> send(NormalizedEvent event) {
            attempts.incrementAndGet();
            if (failing) {
                return CompletableFuture.failedFuture(new PublishException("bus unreachable"));
            }
            sent.add(event);
            return CompletableFuture.completedFuture(new DeliveryReceipt(event.dedupKey(), "test", sent.size() - 1));
        }

        List<String> keysFor(String sourceId) {
            final List<String> keys = new ArrayList<>();
            for (NormalizedEvent e : sent) {
                if (e.sourceId().equals(sourceId)) keys.add(e.dedupKey());
            }
            return keys;
        }

        @Override
        public void flush() {
        }

        @Override
        public void verify() {
        }

        @Override
        public void close() {
        }
    }

    static final class RecordingDedup implements DedupCache {
        final Set<String> marked = ConcurrentHashMap.newKeySet();

        @Override
        public boolean seen(String dedupKey) {
            return marked.contains(dedupKey);
        }

        @Override
        public void mark(String dedupKey, Duration ttl) {
            marked.add(dedupKey);
        }
    }

    /** Answers {@code seen} at once but takes {@code markDelay} for every {@code mark}. */
    static final class SlowMarkDedup implements DedupCache {
        private final Duration markDelay;
        final Set<String> marked = ConcurrentHashMap.newKeySet();
        final AtomicInteger markCalls = new AtomicInteger();

        SlowMarkDedup(Duration markDelay) {
            this.markDelay = markDelay;
        }

        @Override
        public boolean seen(String dedupKey) {
            return marked.contains(dedupKey);
        }

        @Override
        public void mark(String dedupKey, Duration ttl) {
            markCalls.incrementAndGet();
            try {
                Thread.sleep(markDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            marked.add(dedupKey);
        }
    }
}
