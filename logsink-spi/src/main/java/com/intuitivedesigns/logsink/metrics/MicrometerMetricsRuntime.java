/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-backed {@link MetricsRuntime}.
 *
 * Features:
 * - Composite registry: in-memory by default, further backends via {@link #addRegistry(MeterRegistry)}
 * - Push-style gauges mapped onto Micrometer's polled gauges
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    private final String type;

    // Micrometer gauges poll a state object; push-style callers write into these
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    // Released in reverse registration order by close()
    private final Deque<AutoCloseable> resources = new ConcurrentLinkedDeque<>();

    public MicrometerMetricsRuntime() {
        this("MICROMETER", new SimpleMeterRegistry());
    }

    public MicrometerMetricsRuntime(String type, MeterRegistry first) {
        this.type = type;
        this.registry = new CompositeMeterRegistry();
        if (first != null) {
            this.registry.add(first);
        }
    }

    public void addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(specificRegistry);
    }

    /** Ties a resource (e.g. a scrape endpoint) to this runtime's lifetime. */
    public void onClose(AutoCloseable resource) {
        resources.push(resource);
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
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        AtomicDouble state = gaugeState.computeIfAbsent(name, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(key, newState, AtomicDouble::get).register(registry);
            return newState;
        });
        state.set(value);
    }

    @Override
    public void close() {
        AutoCloseable r;
        while ((r = resources.poll()) != null) {
            try {
                r.close();
            } catch (Exception e) {
                log.warn("Failed to release metrics resource {}: {}", r, e.getMessage());
            }
        }
        for (MeterRegistry child : registry.getRegistries()) {
            child.close();
        }
        registry.close();
        log.info("Metrics runtime closed (type={})", type);
    }

    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
