/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

import com.intuitivedesigns.chainkernel.config.KernelConfig;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusMetricsProviderTest {

    @Test
    void testFactorySelectsPrometheusByName() {
        MetricsSettings s = MetricsSettings.from(KernelConfig.of(Map.of(
                "metrics.provider", "prometheus",
                "metrics.prometheus.port", "0"
        )));

        MetricsRuntime rt = MetricsFactory.init(s);
        try {
            assertTrue(rt.enabled());
            assertEquals("PROMETHEUS", rt.type());
        } finally {
            rt.close();
        }
    }

    @Test
    void testCountersAreScrapedOverHttp() throws Exception {
        MetricsSettings s = MetricsSettings.from(KernelConfig.of(Map.of(
                "metrics.provider", "PROMETHEUS",
                "metrics.prometheus.port", "0",
                "metrics.tag.service", "chainkernel"
        )));

        try (PrometheusMetricsProvider.PrometheusRuntime rt =
                     (PrometheusMetricsProvider.PrometheusRuntime) new PrometheusMetricsProvider().create(s)) {
            rt.counter(KernelMetrics.EVENTS_PUBLISHED, 3);
            rt.taggedCounter(KernelMetrics.DECODE_FAILURES, KernelMetrics.TAG_SOURCE, "chainA-main");
            rt.taggedGauge(KernelMetrics.WORKERS, 2, KernelMetrics.TAG_STATUS, "running");

            HttpResponse<String> resp = HttpClient.newHttpClient().send(
                    HttpRequest.newBuilder(URI.create("http://localhost:" + rt.port() + "/metrics")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            assertEquals(200, resp.statusCode());
            assertTrue(resp.body().contains("chainkernel_events_published_total"));
            assertTrue(resp.body().contains("source=\"chainA-main\""));
            assertTrue(resp.body().contains("service=\"chainkernel\""));
            assertTrue(resp.body().contains("status=\"running\""));
        }
    }
}
