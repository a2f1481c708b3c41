/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

/**
 * Service Provider Interface (SPI) for metrics backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.logsink.metrics.MetricsProvider}.</p>
 */
public interface MetricsProvider {

    /**
     * The identifier matched against {@code logsink.metrics.provider} (e.g. "MICROMETER", "PROMETHEUS").
     */
    String id();

    /**
     * @return a runtime if this provider is the configured one, or {@code null} to be skipped
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
