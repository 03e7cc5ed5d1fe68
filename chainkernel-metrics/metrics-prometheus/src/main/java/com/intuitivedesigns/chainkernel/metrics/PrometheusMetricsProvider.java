/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Prometheus scrape endpoint over the JDK HTTP server. Selected by {@code metrics.provider=PROMETHEUS}.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        final PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        reg.config().commonTags(settings.tags());

        final ServerHandle handle = start(reg, settings.prometheusPort(), settings.prometheusPath());
        log.info("Prometheus Metrics Active (port={}, path={}, tags={})",
                handle.port(), settings.prometheusPath(), settings.commonTags());

        return new PrometheusRuntime(reg, handle);
    }

    private static ServerHandle start(PrometheusMeterRegistry registry, int port, String path) {
        Objects.requireNonNull(registry, "registry");

        try {
            final HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);

            final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "ck-metrics-http");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.createContext(path, exchange -> {
                try {
                    final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                    exchange.sendResponseHeaders(200, bytes.length);
                    try (OutputStream os = exchange.getResponseBody()) {
                        os.write(bytes);
                    }
                } catch (Exception e) {
                    log.warn("Metrics scrape failed: {}", e.getMessage());
                    try { exchange.sendResponseHeaders(500, -1); } catch (Exception ignored) {}
                } finally {
                    exchange.close();
                }
            });

            server.start();
            return new ServerHandle(server, executor);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to start Prometheus metrics server on port " + port, e);
        }
    }

    /**
     * Micrometer runtime whose composite also feeds the Prometheus registry.
     */
    static final class PrometheusRuntime implements MetricsRuntime {
        private final MicrometerMetricsRuntime delegate = new MicrometerMetricsRuntime("PROMETHEUS");
        private final PrometheusMeterRegistry prometheus;
        private final ServerHandle handle;

        PrometheusRuntime(PrometheusMeterRegistry prometheus, ServerHandle handle) {
            this.prometheus = prometheus;
            this.handle = handle;
            delegate.addRegistry(prometheus);
        }

        int port() {
            return handle.port();
        }

        String scrape() {
            return prometheus.scrape();
        }

        @Override public Object registry() { return delegate.registry(); }
        @Override public boolean enabled() { return true; }
        @Override public String type() { return "PROMETHEUS"; }
        @Override public void counter(String name) { delegate.counter(name); }
        @Override public void counter(String name, double increment) { delegate.counter(name, increment); }
        @Override public void taggedCounter(String name, String... tagPairs) { delegate.taggedCounter(name, tagPairs); }
        @Override public void timer(String name, long durationMillis) { delegate.timer(name, durationMillis); }
        @Override public void gauge(String name, double value) { delegate.gauge(name, value); }
        @Override public void taggedGauge(String name, double value, String... tagPairs) { delegate.taggedGauge(name, value, tagPairs); }

        @Override
        public void close() {
            handle.close();
            delegate.close();
            prometheus.close();
        }
    }

    private static final class ServerHandle implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ServerHandle(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        int port() {
            return server.getAddress().getPort();
        }

        @Override
        public void close() {
            server.stop(0);
            executor.shutdownNow();
        }
    }
}
