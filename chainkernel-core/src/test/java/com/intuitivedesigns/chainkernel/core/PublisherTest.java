/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.core;

import com.intuitivedesigns.chainkernel.metrics.KernelMetrics;
import com.intuitivedesigns.chainkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.chainkernel.model.DeliveryReceipt;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PublisherTest {

    private final Fixtures.RecordingBus bus = new Fixtures.RecordingBus();
    private final MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
    private Publisher publisher;

    @AfterEach
    void tearDown() {
        if (publisher != null) publisher.close(Duration.ofMillis(200));
        metrics.close();
    }

    @Test
    void testDeliversInPublishOrder() throws Exception {
        publisher = new Publisher(bus, Fixtures.publisherSettings(100, 60_000), metrics);
        publisher.start();

        List<CompletableFuture<DeliveryReceipt>> futures = new ArrayList<>();
        for (long h = 1; h <= 25; h++) {
            futures.add(publisher.publish(Fixtures.event("src-a", h)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        List<Long> heights = new ArrayList<>();
        for (NormalizedEvent e : bus.sent) heights.add(e.position().height());
        for (int i = 0; i < 25; i++) {
            assertEquals(i + 1, heights.get(i));
        }
        assertEquals(25, publisher.publishedTotal());
        assertEquals(25.0, metrics.count(KernelMetrics.EVENTS_PUBLISHED));
    }

    @Test
    void testPublishBlocksWhenBufferFull() throws Exception {
        publisher = new Publisher(bus, Fixtures.publisherSettings(2, 60_000), metrics);

        // Not started yet, so nothing drains the buffer
        publisher.publish(Fixtures.event("src-a", 1));
        publisher.publish(Fixtures.event("src-a", 2));
        assertEquals(2, publisher.buffered());

        Thread blocked = new Thread(() -> {
            try {
                publisher.publish(Fixtures.event("src-a", 3));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        blocked.start();
        blocked.join(200);
        assertTrue(blocked.isAlive(), "publish should block while the buffer is full");

        publisher.start();
        blocked.join(5_000);
        assertFalse(blocked.isAlive());
        assertTrue(Fixtures.await(() -> bus.sent.size() == 3, Duration.ofSeconds(5)));
    }

    @Test
    void testRetriesUntilBusRecoversWithoutReordering() throws Exception {
        publisher = new Publisher(bus, Fixtures.publisherSettings(100, 60_000), metrics);
        bus.failing = true;
        publisher.start();

        CompletableFuture<DeliveryReceipt> f1 = publisher.publish(Fixtures.event("src-a", 1));
        CompletableFuture<DeliveryReceipt> f2 = publisher.publish(Fixtures.event("src-a", 2));
        CompletableFuture<DeliveryReceipt> f3 = publisher.publish(Fixtures.event("src-b", 1));

        assertTrue(Fixtures.await(() -> publisher.retriesTotal() >= 2, Duration.ofSeconds(5)));
        assertFalse(f1.isDone());

        bus.failing = false;
        CompletableFuture.allOf(f1, f2, f3).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("src-a:1:0", "src-a:2:0"), bus.keysFor("src-a"));
        assertEquals(List.of("src-b:1:0"), bus.keysFor("src-b"));
        assertTrue(metrics.count(KernelMetrics.PUBLISH_RETRIES) >= 2.0);
    }

    @Test
    void testSourceDegradedWhileStaleThenRecovered() throws Exception {
        publisher = new Publisher(bus, Fixtures.publisherSettings(100, 50), metrics);
        Map<String, Boolean> health = new ConcurrentHashMap<>();
        publisher.setHealthListener(health::put);
        bus.failing = true;
        publisher.start();

        CompletableFuture<DeliveryReceipt> f = publisher.publish(Fixtures.event("src-a", 1));
        assertTrue(Fixtures.await(() -> Boolean.TRUE.equals(health.get("src-a")), Duration.ofSeconds(5)));

        bus.failing = false;
        f.get(5, TimeUnit.SECONDS);
        assertTrue(Fixtures.await(() -> Boolean.FALSE.equals(health.get("src-a")), Duration.ofSeconds(5)));
    }

    @Test
    void testCloseFailsUndeliveredEvents() throws Exception {
        publisher = new Publisher(bus, Fixtures.publisherSettings(100, 60_000), metrics);
        bus.failing = true;
        publisher.start();

        CompletableFuture<DeliveryReceipt> pending = publisher.publish(Fixtures.event("src-a", 1));
        publisher.close(Duration.ofMillis(100));

        assertTrue(pending.isCompletedExceptionally());
        assertTrue(publisher.publish(Fixtures.event("src-a", 2)).isCompletedExceptionally());
    }
}
