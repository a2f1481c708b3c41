/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Accumulates records taken from the queue until either {@code batchSize} is reached
 * or the flush interval elapses with something pending.
 *
 * <p>Single-threaded: only the pipeline thread calls into it. The interval is measured
 * from the last flush attempt ({@link #markFlushed()}); an interval that elapses with
 * nothing pending just re-arms the timer.</p>
 */
public final class BatchAggregator {

    private final IngestionQueue queue;
    private final int batchSize;
    private final long intervalNanos;
    private final LongSupplier nanoClock;

    private final List<LogRecord> pending;
    private long armedAtNanos;

    public BatchAggregator(IngestionQueue queue, int batchSize, Duration flushInterval) {
        this(queue, batchSize, flushInterval, System::nanoTime);
    }

    BatchAggregator(IngestionQueue queue, int batchSize, Duration flushInterval, LongSupplier nanoClock) {
        this.queue = Objects.requireNonNull(queue, "queue");
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        Objects.requireNonNull(flushInterval, "flushInterval");
        if (flushInterval.isNegative() || flushInterval.isZero()) {
            throw new IllegalArgumentException("flushInterval must be > 0");
        }
        this.batchSize = batchSize;
        this.intervalNanos = saturatedNanos(flushInterval);
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        // A batch can never hold more than the queue does
        this.pending = new ArrayList<>(Math.min(batchSize, queue.capacity()));
        this.armedAtNanos = nanoClock.getAsLong();
    }

    /**
     * Blocks until a batch is ready.
     *
     * @return a batch of exactly {@code batchSize} records (SIZE), or a smaller non-empty one (INTERVAL)
     * @throws InterruptedException if the pipeline thread is interrupted while waiting
     */
    public Batch nextBatch() throws InterruptedException {
        while (true) {
            if (pending.size() >= batchSize) {
                return take(Batch.Trigger.SIZE);
            }

            final long remaining = intervalNanos - (nanoClock.getAsLong() - armedAtNanos);
            if (remaining <= 0) {
                if (!pending.isEmpty()) {
                    return take(Batch.Trigger.INTERVAL);
                }
                armedAtNanos = nanoClock.getAsLong();
                continue;
            }

            final LogRecord first = queue.poll(remaining, TimeUnit.NANOSECONDS);
            if (first != null) {
                pending.add(first);
                // Pick up whatever else is already queued without another wait
                queue.drainTo(pending, batchSize - pending.size());
            }
        }
    }

    /** Re-arms the flush timer. Called once the delivery attempt for the last batch has completed. */
    public void markFlushed() {
        armedAtNanos = nanoClock.getAsLong();
    }

    public int pendingCount() {
        return pending.size();
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private Batch take(Batch.Trigger trigger) {
        Batch batch = new Batch(pending, trigger);
        pending.clear();
        return batch;
    }
}
