/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsRuntime} over a Micrometer composite registry.
 *
 * <p>An in-process {@link SimpleMeterRegistry} is always part of the composite so values can be read back
 * ({@link #count(String)}, tests); providers add their exporting registry with {@link #addRegistry}.
 * Gauges are push-style: the facade sets a value, Micrometer polls the holder.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();
    private final String type;

    // One holder per (name, tags); registered with Micrometer on first set
    private final Map<GaugeKey, GaugeValue> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this("MICROMETER");
    }

    public MicrometerMetricsRuntime(String type) {
        this.type = type;
        registry.add(new SimpleMeterRegistry());
    }

    public void addRegistry(MeterRegistry exporting) {
        registry.add(exporting);
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void taggedCounter(String name, String... tagPairs) {
        registry.counter(name, tags(name, tagPairs)).increment();
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        taggedGauge(name, value);
    }

    @Override
    public void taggedGauge(String name, double value, String... tagPairs) {
        final Tags tags = tags(name, tagPairs);
        gauges.computeIfAbsent(new GaugeKey(name, tags), key -> {
            final GaugeValue holder = new GaugeValue();
            Gauge.builder(key.name(), holder, GaugeValue::get).tags(key.tags()).register(registry);
            return holder;
        }).set(value);
    }

    /**
     * Sum of a counter over all its tag combinations; 0 if it was never incremented.
     */
    public double count(String name) {
        return registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }

    /**
     * Current value of a gauge, or NaN if it was never set.
     */
    public double gaugeValue(String name, String... tagPairs) {
        final GaugeValue holder = gauges.get(new GaugeKey(name, tags(name, tagPairs)));
        return holder == null ? Double.NaN : holder.get();
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics Runtime Closed.");
    }

    private static Tags tags(String name, String... tagPairs) {
        if (tagPairs == null || tagPairs.length == 0) {
            return Tags.empty();
        }
        if (tagPairs.length % 2 != 0) {
            log.debug("Ignoring tags for '{}': expected key/value pairs", name);
            return Tags.empty();
        }
        return Tags.of(tagPairs);
    }

    private record GaugeKey(String name, Tags tags) {}

    private static final class GaugeValue {
        private final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));

        void set(double value) {
            bits.set(Double.doubleToLongBits(value));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }
    }
}
