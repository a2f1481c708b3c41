/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.util.Objects;

/**
 * Producer-side entry point of a running pipeline. Safe to share between any number of threads.
 */
public final class PipelineHandle {

    private final IngestionQueue queue;
    private final PipelineTask task;

    PipelineHandle(IngestionQueue queue, PipelineTask task) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.task = Objects.requireNonNull(task, "task");
    }

    /**
     * Hands a record to the pipeline without blocking.
     *
     * <p>Offers made on the pipeline thread itself (a sink logging its own failures)
     * are rejected and counted as dropped.</p>
     */
    public OfferResult offer(LogRecord record) {
        Objects.requireNonNull(record, "record");
        if (task.isCurrentThread()) {
            return queue.reject(record);
        }
        return queue.offer(record);
    }

    public PipelineCounters counters() {
        return queue.counters();
    }

    public int queueDepth() {
        return queue.size();
    }

    public int capacity() {
        return queue.capacity();
    }

    public String name() {
        return task.name();
    }
}
