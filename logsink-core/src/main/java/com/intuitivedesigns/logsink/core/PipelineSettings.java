/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import com.intuitivedesigns.logsink.config.PipelineConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable pipeline tuning, read once when a pipeline is started.
 *
 * <p>Out-of-range values are clamped rather than rejected, so a bad
 * property can never prevent logging from starting. A batch never exceeds
 * the queue capacity; intervals and backoffs are capped at one hour.</p>
 */
public final class PipelineSettings {

    public static final String KEY_QUEUE_CAPACITY = "logsink.queue.capacity";
    public static final String KEY_BATCH_SIZE = "logsink.batch.size";
    public static final String KEY_FLUSH_INTERVAL_MS = "logsink.flush.interval.ms";
    public static final String KEY_BACKOFF_INITIAL_MS = "logsink.backoff.initial.ms";
    public static final String KEY_BACKOFF_MAX_MS = "logsink.backoff.max.ms";
    public static final String KEY_ECHO = "logsink.echo.enabled";

    /** Logger that receives echoed records, also used by the {@code log://} backend. */
    public static final String ECHO_LOGGER = "logsink.echo";

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;
    public static final int DEFAULT_BATCH_SIZE = 128;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);

    static final int MIN_QUEUE_CAPACITY = 16;
    static final int MAX_QUEUE_CAPACITY = 1 << 24;
    static final Duration MIN_FLUSH_INTERVAL = Duration.ofMillis(10);
    static final Duration MIN_BACKOFF = Duration.ofMillis(1);
    static final Duration MAX_DURATION = Duration.ofHours(1);

    private static final PipelineSettings DEFAULTS = builder().build();

    private final int queueCapacity;
    private final int batchSize;
    private final Duration flushInterval;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final boolean echo;

    private PipelineSettings(Builder b) {
        this.queueCapacity = clamp(b.queueCapacity, MIN_QUEUE_CAPACITY, MAX_QUEUE_CAPACITY);
        this.batchSize = clamp(b.batchSize, 1, this.queueCapacity);
        this.flushInterval = bounded(b.flushInterval, MIN_FLUSH_INTERVAL, DEFAULT_FLUSH_INTERVAL);
        this.initialBackoff = bounded(b.initialBackoff, MIN_BACKOFF, DEFAULT_INITIAL_BACKOFF);
        this.maxBackoff = bounded(b.maxBackoff, this.initialBackoff, DEFAULT_MAX_BACKOFF);
        this.echo = b.echo;
    }

    public static PipelineSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineSettings fromConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "config");
        return builder()
                .queueCapacity(config.getInt(KEY_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY))
                .batchSize(config.getInt(KEY_BATCH_SIZE, DEFAULT_BATCH_SIZE))
                .flushInterval(Duration.ofMillis(config.getLong(KEY_FLUSH_INTERVAL_MS, DEFAULT_FLUSH_INTERVAL.toMillis())))
                .initialBackoff(Duration.ofMillis(config.getLong(KEY_BACKOFF_INITIAL_MS, DEFAULT_INITIAL_BACKOFF.toMillis())))
                .maxBackoff(Duration.ofMillis(config.getLong(KEY_BACKOFF_MAX_MS, DEFAULT_MAX_BACKOFF.toMillis())))
                .echo(config.getBoolean(KEY_ECHO, false))
                .build();
    }

    public int queueCapacity() { return queueCapacity; }

    public int batchSize() { return batchSize; }

    public Duration flushInterval() { return flushInterval; }

    public Duration initialBackoff() { return initialBackoff; }

    public Duration maxBackoff() { return maxBackoff; }

    /** Whether the pipeline thread also writes each dequeued record to {@value #ECHO_LOGGER}. */
    public boolean echo() { return echo; }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(initialBackoff, maxBackoff);
    }

    @Override
    public String toString() {
        return "PipelineSettings{queueCapacity=" + queueCapacity
                + ", batchSize=" + batchSize
                + ", flushInterval=" + flushInterval.toMillis() + "ms"
                + ", initialBackoff=" + initialBackoff.toMillis() + "ms"
                + ", maxBackoff=" + maxBackoff.toMillis() + "ms"
                + ", echo=" + echo + '}';
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static Duration bounded(Duration d, Duration floor, Duration fallback) {
        final Duration v = (d == null || d.isNegative() || d.isZero()) ? fallback : d;
        if (v.compareTo(floor) < 0) return floor;
        return v.compareTo(MAX_DURATION) > 0 ? MAX_DURATION : v;
    }

    public static final class Builder {
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration flushInterval = DEFAULT_FLUSH_INTERVAL;
        private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private boolean echo;

        private Builder() {}

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder echo(boolean echo) {
            this.echo = echo;
            return this;
        }

        public PipelineSettings build() {
            return new PipelineSettings(this);
        }
    }
}
