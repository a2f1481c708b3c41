/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded multi-producer / single-consumer buffer between call sites and the pipeline thread.
 *
 * <p><b>Producer side</b> ({@link #offer(LogRecord)}) never blocks: a full queue rejects the record,
 * counts the drop and returns. Records from one producer keep their submission order.</p>
 *
 * <p><b>Consumer side</b> ({@link #poll(long, TimeUnit)}, {@link #drainTo(Collection, int)}) is used by
 * exactly one thread. Each accepted record is handed out at most once.</p>
 */
public final class IngestionQueue {

    private static final Logger log = LoggerFactory.getLogger(IngestionQueue.class);

    private static final long DROP_LOG_INTERVAL_MS = 1_000L;

    private final ArrayBlockingQueue<LogRecord> queue;
    private final int capacity;
    private final PipelineCounters counters;
    private final RateLimitedLogger dropLog;

    public IngestionQueue(int capacity, PipelineCounters counters) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.counters = Objects.requireNonNull(counters, "counters");
        this.dropLog = new RateLimitedLogger(log, DROP_LOG_INTERVAL_MS);
    }

    /**
     * Non-blocking enqueue.
     *
     * @return {@link OfferResult#ACCEPTED}, or {@link OfferResult#REJECTED} when full
     */
    public OfferResult offer(LogRecord record) {
        Objects.requireNonNull(record, "record");
        counters.recordObserved();

        if (queue.offer(record)) {
            counters.recordEnqueued();
            return OfferResult.ACCEPTED;
        }

        counters.recordDropped();
        dropLog.warn("Log queue full (capacity={}), dropping record level={} target={}",
                capacity, record.level(), record.target());
        return OfferResult.REJECTED;
    }

    /**
     * Counts a record as observed and dropped without touching the queue.
     */
    OfferResult reject(LogRecord record) {
        Objects.requireNonNull(record, "record");
        counters.recordObserved();
        counters.recordDropped();
        return OfferResult.REJECTED;
    }

    /**
     * Waits up to {@code timeout} for the next record.
     *
     * @return the record, or null if none arrived in time
     */
    public LogRecord poll(long timeout, TimeUnit unit) throws InterruptedException {
        LogRecord r = queue.poll(timeout, unit);
        if (r != null) counters.recordDequeued(1);
        return r;
    }

    /**
     * Moves up to {@code max} already-queued records into {@code target} without waiting.
     *
     * @return the number of records moved
     */
    public int drainTo(Collection<? super LogRecord> target, int max) {
        if (max <= 0) return 0;
        int n = queue.drainTo(target, max);
        if (n > 0) counters.recordDequeued(n);
        return n;
    }

    /** Everything currently queued, in order. Consumer side only. */
    public List<LogRecord> drainAll() {
        List<LogRecord> out = new ArrayList<>(queue.size());
        drainTo(out, Integer.MAX_VALUE);
        return out;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public PipelineCounters counters() {
        return counters;
    }
}
