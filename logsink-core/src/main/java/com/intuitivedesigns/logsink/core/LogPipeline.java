/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.util.Objects;

/**
 * A started pipeline: the producer handle plus its background task.
 */
public record LogPipeline(PipelineHandle handle, PipelineTask task) {

    public LogPipeline {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(task, "task");
    }

    public OfferResult offer(LogRecord record) {
        return handle.offer(record);
    }

    public CountersSnapshot counters() {
        return handle.counters().snapshot();
    }
}
