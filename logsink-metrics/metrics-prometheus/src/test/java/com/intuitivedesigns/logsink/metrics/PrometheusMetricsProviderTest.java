/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

import com.intuitivedesigns.logsink.config.PipelineConfig;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusMetricsProviderTest {

    private static final HttpClient HTTP = HttpClient.newHttpClient();

    @Test
    void testScrapeEndpointServesRegistry() throws Exception {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        registry.counter("logsink.records.dropped").increment(5);

        try (PrometheusMetricsProvider.ScrapeEndpoint endpoint = PrometheusMetricsProvider.start(registry, 0, "/metrics")) {
            HttpResponse<String> response = HTTP.send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + endpoint.port() + "/metrics")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            assertEquals(200, response.statusCode());
            assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
            assertTrue(response.body().contains("logsink_records_dropped_total 5.0"));
        } finally {
            registry.close();
        }
    }

    @Test
    void testProviderIsSelectedByConfig() throws Exception {
        int port = freePort();
        MetricsRuntime rt = MetricsFactory.init(PipelineConfig.of(Map.of(
                "logsink.metrics.provider", "PROMETHEUS",
                "logsink.metrics.prometheus.port", Integer.toString(port),
                "logsink.metrics.tag.service", "api")));
        try {
            assertEquals("PROMETHEUS", rt.type());
            rt.counter("logsink.delivery.failures");

            HttpResponse<String> response = HTTP.send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/metrics")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            assertTrue(response.body().contains("logsink_delivery_failures_total{service=\"api\""), response.body());
        } finally {
            rt.close();
        }
    }

    @Test
    void testOtherProviderIdIsSkipped() {
        MetricsSettings s = MetricsSettings.from(PipelineConfig.of(Map.of("logsink.metrics.provider", "MICROMETER")));
        assertNull(new PrometheusMetricsProvider().create(s));
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
