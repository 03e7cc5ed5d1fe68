/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.memory;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import com.intuitivedesigns.chainkernel.core.EventBus;
import com.intuitivedesigns.chainkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.chainkernel.model.DeliveryReceipt;
import com.intuitivedesigns.chainkernel.model.EventCodec;
import com.intuitivedesigns.chainkernel.model.NormalizedEvent;
import com.intuitivedesigns.chainkernel.spi.BusPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An event bus that writes each event to the log as JSON.
 * Useful for development and dry runs where no Kafka cluster is available.
 * <p>
 * ID: LOG
 */
public final class LogBusPlugin implements BusPlugin {

    public static final String ID = "LOG";
    private static final Logger log = LoggerFactory.getLogger(LogBusPlugin.class);

    private static final String CFG_LOG_LEVEL = "bus.log.level";
    private static final String CFG_MAX_LOG_CHARS = "bus.log.max.chars";

    private static final String DEFAULT_LOG_LEVEL = "INFO";
    private static final int DEFAULT_MAX_LOG_CHARS = 2048;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventBus create(KernelConfig config, MetricsRuntime metrics) {
        final String level = config.getString(CFG_LOG_LEVEL, DEFAULT_LOG_LEVEL).trim().toUpperCase(Locale.ROOT);
        final int maxChars = Math.max(64, config.getInt(CFG_MAX_LOG_CHARS, DEFAULT_MAX_LOG_CHARS));
        log.info("🔌 Initialized log event bus (Level={}, MaxChars={})", level, maxChars);
        return new LogEventBus(level, maxChars);
    }

    static final class LogEventBus implements EventBus {
        private final String level;
        private final int maxChars;
        private final AtomicLong offset = new AtomicLong();

        LogEventBus(String level, int maxChars) {
            this.level = level;
            this.maxChars = maxChars;
        }

        @Override
        public CompletableFuture<DeliveryReceipt> send(NormalizedEvent event) {
            final long next = offset.getAndIncrement();
            if (shouldLog(level)) {
                String json = EventCodec.toJson(event);
                if (json.length() > maxChars) {
                    json = json.substring(0, maxChars) + "... [TRUNCATED]";
                }
                logAtLevel(level, "[BUS] {} | {}", event.dedupKey(), json);
            }
            return CompletableFuture.completedFuture(new DeliveryReceipt(event.dedupKey(), "log", next));
        }

        long sent() {
            return offset.get();
        }

        @Override
        public void flush() {
            // nothing buffered
        }

        @Override
        public void verify() {
            // always reachable
        }

        @Override
        public void close() {
            log.info("Log event bus closed after {} event(s)", offset.get());
        }
    }

    private static boolean shouldLog(String level) {
        return switch (level) {
            case "WARN"  -> log.isWarnEnabled();
            case "DEBUG" -> log.isDebugEnabled();
            case "TRACE" -> log.isTraceEnabled();
            case "OFF"   -> false;
            default      -> log.isInfoEnabled();
        };
    }

    private static void logAtLevel(String level, String fmt, Object a, Object b) {
        switch (level) {
            case "WARN"  -> log.warn(fmt, a, b);
            case "DEBUG" -> log.debug(fmt, a, b);
            case "TRACE" -> log.trace(fmt, a, b);
            case "OFF"   -> { /* no-op */ }
            default      -> log.info(fmt, a, b);
        }
    }
}
