/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.util.concurrent.atomic.LongAdder;

/**
 * Monotonic counters shared by the producer path (observed / enqueued / dropped)
 * and the pipeline thread (dequeued / delivered / retries). Never reset.
 */
public final class PipelineCounters {

    private final LongAdder observed = new LongAdder();
    private final LongAdder enqueued = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final LongAdder dequeued = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder batchesDelivered = new LongAdder();
    private final LongAdder retries = new LongAdder();

    void recordObserved() { observed.increment(); }

    void recordEnqueued() { enqueued.increment(); }

    void recordDropped() { dropped.increment(); }

    void recordDequeued(int count) { dequeued.add(count); }

    void recordDelivered(int records) {
        delivered.add(records);
        batchesDelivered.increment();
    }

    void recordRetry() { retries.increment(); }

    public long observed() { return observed.sum(); }

    public long enqueued() { return enqueued.sum(); }

    public long dropped() { return dropped.sum(); }

    public long dequeued() { return dequeued.sum(); }

    public long delivered() { return delivered.sum(); }

    public long batchesDelivered() { return batchesDelivered.sum(); }

    public long retries() { return retries.sum(); }

    public CountersSnapshot snapshot() {
        return new CountersSnapshot(
                observed.sum(),
                enqueued.sum(),
                dropped.sum(),
                dequeued.sum(),
                delivered.sum(),
                batchesDelivered.sum(),
                retries.sum()
        );
    }
}
