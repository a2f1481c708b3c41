/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Prometheus backend: a {@link PrometheusMeterRegistry} plus a scrape endpoint
 * served by the JDK {@link HttpServer} on {@code logsink.metrics.prometheus.port}.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // SPI contract: return null if not applicable
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        final MicrometerMetricsRuntime rt = new MicrometerMetricsRuntime("PROMETHEUS", reg);
        MetricsUtil.applyCommonTags(rt.registry(), s);
        rt.onClose(start(reg, s.prometheusPort, s.prometheusPath));

        log.info("Prometheus metrics active (port={}, path={})", s.prometheusPort, s.prometheusPath);
        return rt;
    }

    static ScrapeEndpoint start(PrometheusMeterRegistry registry, int port, String path) {
        Objects.requireNonNull(registry, "registry");

        final HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start Prometheus metrics server on port " + port, e);
        }

        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "logsink-metrics-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext(path, exchange -> {
            try {
                final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE);
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Prometheus scrape failed: {}", e.getMessage());
                exchange.sendResponseHeaders(500, -1);
            } finally {
                exchange.close();
            }
        });

        server.start();
        return new ScrapeEndpoint(server, executor);
    }

    static final class ScrapeEndpoint implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ScrapeEndpoint(HttpServer server, ExecutorService executor) {
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

        @Override
        public String toString() {
            return "ScrapeEndpoint{port=" + port() + '}';
        }
    }
}
