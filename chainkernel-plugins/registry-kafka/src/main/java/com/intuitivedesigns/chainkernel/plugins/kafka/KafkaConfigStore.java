/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.kafka;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.ConfigStore;
import com.intuitivedesigns.chainkernel.core.RegistryWatch;
import com.intuitivedesigns.chainkernel.error.ConfigException;
import com.intuitivedesigns.chainkernel.error.RegistryException;
import com.intuitivedesigns.chainkernel.model.RegistryChange;
import com.intuitivedesigns.chainkernel.model.RegistrySnapshot;
import com.intuitivedesigns.chainkernel.model.SourceConfig;
import com.intuitivedesigns.chainkernel.model.SourceConfigCodec;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Source registry on a compacted Kafka topic: key = source id, value = SourceConfig JSON,
 * tombstone = delete.
 *
 * <p>Partitions are assigned manually and nothing is committed; the cursor is the per-partition
 * end offset observed by {@link #list()} ({@code "0:15,1:7"}).</p>
 */
public final class KafkaConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(KafkaConfigStore.class);

    public static final String KEY_TOPIC = "registry.kafka.topic";
    public static final String KEY_POLL_MS = "registry.kafka.poll.ms";
    public static final String KEY_LIST_TIMEOUT_MS = "registry.kafka.list.timeout.ms";
    public static final String DEFAULT_TOPIC = "chainkernel.sources";

    private final Supplier<Consumer<String, String>> consumers;
    private final String topic;
    private final Duration pollDuration;
    private final Duration listTimeout;

    public KafkaConfigStore(Supplier<Consumer<String, String>> consumers, String topic,
                            Duration pollDuration, Duration listTimeout) {
        this.consumers = consumers;
        this.topic = topic;
        this.pollDuration = pollDuration;
        this.listTimeout = listTimeout;
    }

    public static KafkaConfigStore fromConfig(KernelConfig config) {
        final String topic = config.getString(KEY_TOPIC, DEFAULT_TOPIC);
        final Properties props = buildConsumerProps(config);
        return new KafkaConfigStore(() -> new KafkaConsumer<>(props), topic,
                config.getMillis(KEY_POLL_MS, 200L),
                config.getMillis(KEY_LIST_TIMEOUT_MS, 30_000L));
    }

    static Properties buildConsumerProps(KernelConfig config) {
        final Properties props = new Properties();

        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString("kafka.broker", "localhost:9092"));
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, config.getString("registry.kafka.client.id", "chainkernel-registry"));
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());

        // Manual assignment; no group, no commits
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, config.getString("registry.kafka.max.poll.records", "500"));

        // Security passthrough
        for (String key : config.keys()) {
            if (key.startsWith("kafka.ssl.") || key.startsWith("kafka.security.") || key.startsWith("kafka.sasl.")) {
                props.put(key.substring(6), config.getString(key, ""));
            }
        }
        return props;
    }

    @Override
    public RegistrySnapshot list() throws RegistryException {
        final Consumer<String, String> consumer = consumers.get();
        try {
            final List<TopicPartition> partitions = partitions(consumer);
            consumer.assign(partitions);
            consumer.seekToBeginning(partitions);
            final Map<TopicPartition, Long> end = consumer.endOffsets(partitions);

            final Map<String, String> latest = new LinkedHashMap<>();
            final long deadline = System.nanoTime() + listTimeout.toNanos();
            while (!reached(consumer, end)) {
                if (System.nanoTime() - deadline > 0) {
                    throw new RegistryException("Timed out reading registry topic '" + topic + "'");
                }
                for (ConsumerRecord<String, String> rec : consumer.poll(pollDuration)) {
                    if (rec.key() == null) continue;
                    if (rec.value() == null) {
                        latest.remove(rec.key());
                    } else {
                        // Re-insert so iteration follows last-write order
                        latest.remove(rec.key());
                        latest.put(rec.key(), rec.value());
                    }
                }
            }

            final List<SourceConfig> configs = new ArrayList<>();
            final Map<String, String> invalid = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : latest.entrySet()) {
                try {
                    configs.add(SourceConfigCodec.decode(e.getKey(), e.getValue()));
                } catch (ConfigException ce) {
                    invalid.put(e.getKey(), ce.getMessage());
                }
            }
            log.debug("Registry topic '{}' listed: {} sources, {} invalid", topic, configs.size(), invalid.size());
            return new RegistrySnapshot(configs, invalid, encodeCursor(end));
        } catch (KafkaException e) {
            throw new RegistryException("Reading registry topic '" + topic + "' failed: " + e.getMessage(), e);
        } finally {
            closeQuietly(consumer);
        }
    }

    @Override
    public RegistryWatch watch(String cursor) throws RegistryException {
        final Map<TopicPartition, Long> offsets = decodeCursor(cursor);
        final Consumer<String, String> consumer = consumers.get();
        try {
            consumer.assign(offsets.keySet());
            offsets.forEach(consumer::seek);
        } catch (KafkaException e) {
            closeQuietly(consumer);
            throw new RegistryException("Watching registry topic '" + topic + "' failed: " + e.getMessage(), e);
        }
        return new KafkaWatch(consumer);
    }

    private List<TopicPartition> partitions(Consumer<String, String> consumer) throws RegistryException {
        final List<PartitionInfo> infos = consumer.partitionsFor(topic);
        if (infos == null || infos.isEmpty()) {
            throw new RegistryException("Registry topic '" + topic + "' not found");
        }
        final List<TopicPartition> out = new ArrayList<>(infos.size());
        for (PartitionInfo info : infos) {
            out.add(new TopicPartition(info.topic(), info.partition()));
        }
        return out;
    }

    private static boolean reached(Consumer<String, String> consumer, Map<TopicPartition, Long> end) {
        for (Map.Entry<TopicPartition, Long> e : end.entrySet()) {
            if (consumer.position(e.getKey()) < e.getValue()) {
                return false;
            }
        }
        return true;
    }

    String encodeCursor(Map<TopicPartition, Long> offsets) {
        final StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Long> e : byPartition(offsets).entrySet()) {
            if (sb.length() > 0) sb.append(',');
            sb.append(e.getKey()).append(':').append(e.getValue());
        }
        return sb.toString();
    }

    Map<TopicPartition, Long> decodeCursor(String cursor) throws RegistryException {
        if (cursor == null || cursor.isBlank()) {
            throw new RegistryException("Empty registry cursor");
        }
        final Map<TopicPartition, Long> out = new LinkedHashMap<>();
        try {
            for (String part : cursor.split(",")) {
                final int colon = part.indexOf(':');
                out.put(new TopicPartition(topic, Integer.parseInt(part.substring(0, colon).trim())),
                        Long.parseLong(part.substring(colon + 1).trim()));
            }
        } catch (RuntimeException e) {
            throw new RegistryException("Malformed registry cursor '" + cursor + "'", e);
        }
        return out;
    }

    private static Map<Integer, Long> byPartition(Map<TopicPartition, Long> offsets) {
        final Map<Integer, Long> sorted = new TreeMap<>();
        offsets.forEach((tp, off) -> sorted.put(tp.partition(), off));
        return sorted;
    }

    private static void closeQuietly(Consumer<String, String> consumer) {
        try {
            consumer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Error closing registry consumer", e);
        }
    }

    /**
     * The consumer is only touched by the thread calling {@link #next}; {@link #close()} from any
     * other thread wakes it and leaves the actual close to that thread.
     */
    private final class KafkaWatch implements RegistryWatch {

        private final Consumer<String, String> consumer;
        private final ArrayDeque<RegistryChange> pending = new ArrayDeque<>();
        private volatile boolean closed;
        private volatile Thread owner;
        private boolean released;

        KafkaWatch(Consumer<String, String> consumer) {
            this.consumer = consumer;
        }

        @Override
        public RegistryChange next(Duration timeout) throws RegistryException, InterruptedException {
            owner = Thread.currentThread();
            if (closed) {
                release();
                return null;
            }
            if (!pending.isEmpty()) {
                return pending.poll();
            }

            try {
                for (ConsumerRecord<String, String> rec : consumer.poll(timeout)) {
                    if (rec.key() != null) {
                        pending.add(toChange(rec.key(), rec.value()));
                    }
                }
            } catch (WakeupException e) {
                release();
                return null;
            } catch (InterruptException e) {
                throw new InterruptedException("Interrupted while watching registry topic '" + topic + "'");
            } catch (KafkaException e) {
                throw new RegistryException("Registry topic '" + topic + "' watch failed: " + e.getMessage(), e);
            }
            return pending.poll();
        }

        @Override
        public void close() {
            closed = true;
            final Thread t = owner;
            if (t == null || t == Thread.currentThread()) {
                release();
            } else {
                consumer.wakeup();
            }
        }

        private synchronized void release() {
            if (!released) {
                released = true;
                closeQuietly(consumer);
            }
        }
    }

    static RegistryChange toChange(String key, String value) {
        if (value == null) {
            return RegistryChange.delete(key);
        }
        try {
            return RegistryChange.put(SourceConfigCodec.decode(key, value));
        } catch (ConfigException e) {
            return RegistryChange.invalid(key, e.getMessage());
        }
    }
}
