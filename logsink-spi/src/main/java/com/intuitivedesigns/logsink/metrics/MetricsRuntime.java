/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

/**
 * Vendor-agnostic metrics facade used by the pipeline and the sinks.
 *
 * <p>Every method has a no-op default, so a pipeline runs unchanged when no metrics
 * backend is configured. Callers needing tags or function-based meters ask for
 * {@link #registry()} and check whether it is a Micrometer {@code MeterRegistry}.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /** No-op runtime, for callers that were given no metrics. */
    MetricsRuntime NOOP = () -> null;

    /**
     * The backing registry (e.g. a Micrometer {@code MeterRegistry}), or null when disabled.
     * Typed as Object so implementations are free to pick their backend.
     */
    Object registry();

    default boolean enabled() { return false; }

    /** Implementation identifier, e.g. "MICROMETER", "PROMETHEUS", "NOOP". */
    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // nothing to release
    }
}
