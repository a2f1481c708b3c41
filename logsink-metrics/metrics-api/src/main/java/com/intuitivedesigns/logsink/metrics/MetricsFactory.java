/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

import com.intuitivedesigns.logsink.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Picks the {@link MetricsProvider} named by {@code logsink.metrics.provider}.
 * Falls back to {@link MetricsRuntime#NOOP} when none is configured or none can start.
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(PipelineConfig config) {
        return init(MetricsSettings.from(config));
    }

    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");

        if ("NONE".equals(settings.providerId) || "NOOP".equals(settings.providerId)) {
            log.info("Metrics disabled (provider={})", settings.providerId);
            return MetricsRuntime.NOOP;
        }

        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, resolveClassLoader());
        for (MetricsProvider p : loader) {
            try {
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics runtime initialized: {} ({})", rt.type(), p.getClass().getName());
                    return rt;
                }
            } catch (LinkageError | RuntimeException e) {
                // A provider whose backend jar is missing must not take logging down with it
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), e.getMessage());
                log.debug("Provider init stack trace:", e);
            }
        }

        log.warn("No metrics provider matched '{}' (NOOP active)", settings.providerId);
        return MetricsRuntime.NOOP;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
