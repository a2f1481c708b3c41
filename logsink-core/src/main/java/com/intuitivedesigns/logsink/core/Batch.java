/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.util.List;
import java.util.Objects;

/**
 * An ordered run of records closed by either the size or the interval trigger.
 * Owned by the pipeline thread; never shared with producers.
 */
public record Batch(List<LogRecord> records, Trigger trigger) {

    public enum Trigger { SIZE, INTERVAL }

    public Batch {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(trigger, "trigger");
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
