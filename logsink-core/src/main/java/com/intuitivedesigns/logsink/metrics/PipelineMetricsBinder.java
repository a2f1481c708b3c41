/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

import com.intuitivedesigns.logsink.core.PipelineCounters;
import com.intuitivedesigns.logsink.core.PipelineHandle;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Objects;
import java.util.function.ToLongFunction;

/**
 * Publishes a pipeline's counters and queue depth as Micrometer meters tagged with the pipeline name.
 * Meters read the live counters; nothing is pushed from the hot path.
 */
public final class PipelineMetricsBinder {

    public static final String TAG_PIPELINE = "pipeline";

    private PipelineMetricsBinder() {}

    /**
     * @return false when the runtime has no Micrometer registry behind it
     */
    public static boolean bind(MetricsRuntime metrics, PipelineHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (metrics == null || !(metrics.registry() instanceof MeterRegistry registry)) {
            return false;
        }

        final Tags tags = Tags.of(TAG_PIPELINE, handle.name());
        final PipelineCounters c = handle.counters();

        counter(registry, "logsink.records.observed", "Records offered by producers", c, PipelineCounters::observed, tags);
        counter(registry, "logsink.records.enqueued", "Records accepted into the queue", c, PipelineCounters::enqueued, tags);
        counter(registry, "logsink.records.dropped", "Records rejected because the queue was full", c, PipelineCounters::dropped, tags);
        counter(registry, "logsink.records.dequeued", "Records taken by the pipeline thread", c, PipelineCounters::dequeued, tags);
        counter(registry, "logsink.records.delivered", "Records written by a successful delivery pass", c, PipelineCounters::delivered, tags);
        counter(registry, "logsink.batches.delivered", "Batches delivered", c, PipelineCounters::batchesDelivered, tags);
        counter(registry, "logsink.delivery.retries", "Failed delivery passes", c, PipelineCounters::retries, tags);

        Gauge.builder("logsink.queue.depth", handle, PipelineHandle::queueDepth)
                .description("Records waiting in the queue")
                .tags(tags)
                .register(registry);
        Gauge.builder("logsink.queue.capacity", handle, PipelineHandle::capacity)
                .tags(tags)
                .register(registry);
        return true;
    }

    private static void counter(MeterRegistry registry, String name, String description,
                                PipelineCounters counters, ToLongFunction<PipelineCounters> fn,
                                Tags tags) {
        FunctionCounter.builder(name, counters, c -> fn.applyAsLong(c))
                .description(description)
                .tags(tags)
                .register(registry);
    }
}
