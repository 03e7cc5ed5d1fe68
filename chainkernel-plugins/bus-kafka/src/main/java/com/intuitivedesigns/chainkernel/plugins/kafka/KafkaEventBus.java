/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.plugins.kafka;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.EventBus;
import com.intuitivedesigns.chainkernel.error.PublishException;
import com.intuitivedesigns.chainkernel.logging.ThrottledLog;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.model.DeliveryReceipt;
import com.intuitivedesigns.chainkernel.model.EventCodec;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Event bus over a Kafka producer.
 *
 * <ul>
 *   <li>key = source id, so one source stays on one partition in order</li>
 *   <li>value = event JSON</li>
 *   <li>headers {@code dedup_key} (idempotency token) and {@code chain_type}</li>
 * </ul>
 *
 * Idempotent producer with {@code acks=all}, so broker-side retries cannot reorder a source's events.
 */
public final class KafkaEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventBus.class);

    public static final String KEY_TOPIC = "bus.topic";
    public static final String DEFAULT_TOPIC = "chainkernel.events";
    public static final String HEADER_DEDUP_KEY = "dedup_key";
    public static final String HEADER_CHAIN_TYPE = "chain_type";

    private static final String KEY_ERROR_LOG_INTERVAL_MS = "bus.kafka.error.log.interval.ms";
    private static final long DEFAULT_ERROR_LOG_INTERVAL_MS = 1_000L;

    /** Config prefixes copied to the producer with the leading {@code kafka.} removed. */
    private static final List<String> PASSTHROUGH_PREFIXES = List.of("kafka.ssl.", "kafka.security.", "kafka.sasl.");

    private final Producer<String, String> producer;
    private final String topic;
    private final SendStats stats;
    private final ThrottledLog errorLog;

    public KafkaEventBus(Producer<String, String> producer, String topic, MetricsRuntime metrics, long errorLogIntervalMs) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.stats = new SendStats(topic, metrics);
        this.errorLog = ThrottledLog.error(log, errorLogIntervalMs);
        log.info("KafkaEventBus active. topic='{}'", topic);
    }

    public static KafkaEventBus fromConfig(KernelConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        return new KafkaEventBus(
                new KafkaProducer<>(buildProducerProps(config)),
                config.getString(KEY_TOPIC, DEFAULT_TOPIC),
                metrics,
                config.getLong(KEY_ERROR_LOG_INTERVAL_MS, DEFAULT_ERROR_LOG_INTERVAL_MS));
    }

    static Properties buildProducerProps(KernelConfig config) {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString("kafka.broker", "localhost:9092"));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, config.getString("kafka.producer.client.id", "chainkernel-bus"));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        // Idempotence keeps a source's events in order across broker retries
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");

        copy(config, props, ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, "kafka.producer.delivery.timeout.ms", "120000");
        copy(config, props, ProducerConfig.MAX_BLOCK_MS_CONFIG, "kafka.producer.max.block.ms", "10000");
        copy(config, props, ProducerConfig.COMPRESSION_TYPE_CONFIG, "kafka.producer.compression", "lz4");
        copy(config, props, ProducerConfig.BATCH_SIZE_CONFIG, "kafka.producer.batch.size", "65536");
        copy(config, props, ProducerConfig.LINGER_MS_CONFIG, "kafka.producer.linger.ms", "5");

        for (String key : config.keys()) {
            for (String prefix : PASSTHROUGH_PREFIXES) {
                if (key.startsWith(prefix)) {
                    props.put(key.substring("kafka.".length()), config.getString(key, ""));
                }
            }
        }
        return props;
    }

    private static void copy(KernelConfig config, Properties props, String producerKey, String configKey, String fallback) {
        props.put(producerKey, config.getString(configKey, fallback).trim());
    }

    @Override
    public CompletableFuture<DeliveryReceipt> send(NormalizedEvent event) {
        final CompletableFuture<DeliveryReceipt> result = new CompletableFuture<>();
        final long startNs = System.nanoTime();
        try {
            final ProducerRecord<String, String> record =
                    new ProducerRecord<>(topic, event.sourceId(), EventCodec.toJson(event));
            record.headers().add(HEADER_DEDUP_KEY, event.dedupKey().getBytes(StandardCharsets.UTF_8));
            record.headers().add(HEADER_CHAIN_TYPE, event.chainType().getBytes(StandardCharsets.UTF_8));

            producer.send(record, (metadata, exception) -> {
                stats.record(exception == null, startNs);
                if (exception == null) {
                    result.complete(new DeliveryReceipt(event.dedupKey(),
                            metadata.topic() + "-" + metadata.partition(), metadata.offset()));
                } else {
                    errorLog.report("Kafka send failed topic=" + topic, exception);
                    result.completeExceptionally(new PublishException("Kafka send failed for " + event.dedupKey(), exception));
                }
            });
        } catch (RuntimeException e) {
            stats.record(false, startNs);
            errorLog.report("Kafka send rejected topic=" + topic, e);
            result.completeExceptionally(new PublishException("Kafka send rejected for " + event.dedupKey(), e));
        }
        return result;
    }

    @Override
    public void flush() {
        producer.flush();
    }

    @Override
    public void verify() throws PublishException {
        try {
            final List<PartitionInfo> partitions = producer.partitionsFor(topic);
            if (partitions == null || partitions.isEmpty()) {
                log.warn("Bus topic '{}' has no partitions yet; relying on broker auto-creation", topic);
            } else {
                log.info("Bus topic '{}' reachable ({} partitions)", topic, partitions.size());
            }
        } catch (KafkaException e) {
            throw new PublishException("Bus topic '" + topic + "' unreachable: " + e.getMessage(), e);
        }
    }

    public long sentOkTotal() {
        return stats.ok.sum();
    }

    public long sentFailTotal() {
        return stats.failed.sum();
    }

    @Override
    public void close() {
        log.info("Closing KafkaEventBus (topic={})...", topic);
        try {
            producer.flush();
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("KafkaEventBus close failed", e);
        }
    }

    /** Local totals always; Micrometer meters only when a registry is live. */
    private static final class SendStats {
        final LongAdder ok = new LongAdder();
        final LongAdder failed = new LongAdder();
        private final Counter okMeter;
        private final Counter failedMeter;
        private final Timer latency;

        SendStats(String topic, MetricsRuntime metrics) {
            final MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry)
                    ? (MeterRegistry) metrics.registry()
                    : null;
            this.okMeter = registry == null ? null : registry.counter("chainkernel_kafka_send_ok_total", "topic", topic);
            this.failedMeter = registry == null ? null : registry.counter("chainkernel_kafka_send_fail_total", "topic", topic);
            this.latency = registry == null ? null : registry.timer("chainkernel_kafka_send_latency", "topic", topic);
        }

        void record(boolean success, long startNs) {
            (success ? ok : failed).increment();
            final Counter meter = success ? okMeter : failedMeter;
            if (meter != null) meter.increment();
            if (latency != null) latency.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        }
    }
}
