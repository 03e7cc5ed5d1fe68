/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.kafka;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.RegistryWatch;
import com.intuitivedesigns.chainkernel.error.RegistryException;
import com.intuitivedesigns.chainkernel.model.RegistryChange;
import com.intuitivedesigns.chainkernel.model.RegistrySnapshot;
import com.intuitivedesigns.chainkernel.model.SourceConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConfigStoreTest {

    private static final String TOPIC = "chainkernel.sources";
    private static final TopicPartition P0 = new TopicPartition(TOPIC, 0);
    private static final TopicPartition P1 = new TopicPartition(TOPIC, 1);

    private final Deque<MockConsumer<String, String>> consumers = new ArrayDeque<>();
    private final KafkaConfigStore store = new KafkaConfigStore(consumers::poll, TOPIC,
            Duration.ofMillis(10), Duration.ofSeconds(2));

    private static String json(String id, String chain) {
        return "{\"id\":\"" + id + "\",\"chain_type\":\"" + chain + "\",\"endpoint\":\"http://node/" + id + "\",\"enabled\":true}";
    }

    private MockConsumer<String, String> listConsumer(long end0, long end1) {
        MockConsumer<String, String> mock = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        mock.updatePartitions(TOPIC, List.of(
                new PartitionInfo(TOPIC, 0, null, null, null),
                new PartitionInfo(TOPIC, 1, null, null, null)));
        mock.updateBeginningOffsets(Map.of(P0, 0L, P1, 0L));
        mock.updateEndOffsets(Map.of(P0, end0, P1, end1));
        consumers.add(mock);
        return mock;
    }

    private MockConsumer<String, String> watchConsumer() {
        MockConsumer<String, String> mock = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumers.add(mock);
        return mock;
    }

    @Test
    void testListCompactsToLatestValuePerKey() throws Exception {
        MockConsumer<String, String> mock = listConsumer(4, 1);
        mock.schedulePollTask(() -> {
            mock.addRecord(new ConsumerRecord<>(TOPIC, 0, 0, "eth-1", json("eth-1", "evm")));
            mock.addRecord(new ConsumerRecord<>(TOPIC, 0, 1, "sol-1", json("sol-1", "svm")));
            mock.addRecord(new ConsumerRecord<>(TOPIC, 0, 2, "eth-1", json("eth-1", "EVM").replace("node/eth-1", "node/v2")));
            mock.addRecord(new ConsumerRecord<>(TOPIC, 0, 3, "sol-1", null));
            mock.addRecord(new ConsumerRecord<>(TOPIC, 1, 0, "bad", "{not json"));
        });

        RegistrySnapshot snap = store.list();

        assertEquals(1, snap.configs().size());
        SourceConfig eth = snap.configs().get(0);
        assertEquals("eth-1", eth.id());
        assertEquals("evm", eth.chainType());
        assertEquals("http://node/v2", eth.endpoint());
        assertTrue(snap.invalid().containsKey("bad"));
        assertEquals("0:4,1:1", snap.cursor());
        assertTrue(mock.closed());
    }

    @Test
    void testEmptyTopicNeedsNoPoll() throws Exception {
        listConsumer(0, 0);

        RegistrySnapshot snap = store.list();

        assertTrue(snap.configs().isEmpty());
        assertEquals("0:0,1:0", snap.cursor());
    }

    @Test
    void testMissingTopic() {
        consumers.add(new MockConsumer<>(OffsetResetStrategy.EARLIEST));

        RegistryException ex = assertThrows(RegistryException.class, store::list);
        assertTrue(ex.getMessage().contains("not found"));
    }

    @Test
    void testWatchResumesFromCursor() throws Exception {
        MockConsumer<String, String> mock = watchConsumer();
        mock.schedulePollTask(() -> {
            mock.addRecord(new ConsumerRecord<>(TOPIC, 0, 4, "eth-2", json("eth-2", "evm")));
            mock.addRecord(new ConsumerRecord<>(TOPIC, 0, 5, "eth-1", null));
            mock.addRecord(new ConsumerRecord<>(TOPIC, 0, 6, "x", "[]"));
        });

        try (RegistryWatch watch = store.watch("0:4,1:1")) {
            RegistryChange put = watch.next(Duration.ofMillis(10));
            RegistryChange delete = watch.next(Duration.ofMillis(10));
            RegistryChange invalid = watch.next(Duration.ofMillis(10));

            assertEquals(RegistryChange.Type.PUT, put.type());
            assertEquals("eth-2", put.config().id());
            assertEquals(RegistryChange.Type.DELETE, delete.type());
            assertEquals("eth-1", delete.sourceId());
            assertEquals(RegistryChange.Type.INVALID, invalid.type());
            assertNull(watch.next(Duration.ofMillis(10)));
            assertEquals(7L, mock.position(P0));
            assertEquals(1L, mock.position(P1));
        }
    }

    @Test
    void testTransportFailureSurfaces() throws Exception {
        MockConsumer<String, String> mock = watchConsumer();
        mock.setPollException(new KafkaException("broker gone"));

        try (RegistryWatch watch = store.watch("0:0")) {
            RegistryException ex = assertThrows(RegistryException.class, () -> watch.next(Duration.ofMillis(10)));
            assertTrue(ex.getMessage().contains("broker gone"));
        }
    }

    @Test
    void testCloseFromAnotherThreadWakesWatcher() throws Exception {
        MockConsumer<String, String> mock = watchConsumer();
        RegistryWatch watch = store.watch("0:0");

        Thread watcher = new Thread(() -> {
            try {
                watch.next(Duration.ofMillis(10));
            } catch (Exception e) {
                throw new AssertionError(e);
            }
        });
        watcher.start();
        watcher.join(2000);

        watch.close();
        assertFalse(mock.closed());

        assertNull(watch.next(Duration.ofMillis(10)));
        assertTrue(mock.closed());
    }

    @Test
    void testMalformedCursor() {
        assertThrows(RegistryException.class, () -> store.watch("zero:four"));
        assertThrows(RegistryException.class, () -> store.watch(""));
    }

    @Test
    void testSecurityPassthrough() {
        Properties props = KafkaConfigStore.buildConsumerProps(KernelConfig.of(Map.of(
                "kafka.broker", "broker:9093",
                "kafka.security.protocol", "SASL_SSL",
                "kafka.sasl.mechanism", "PLAIN")));

        assertEquals("broker:9093", props.get("bootstrap.servers"));
        assertEquals("SASL_SSL", props.get("security.protocol"));
        assertEquals("PLAIN", props.get("sasl.mechanism"));
        assertEquals("false", props.get("enable.auto.commit"));
    }
}
