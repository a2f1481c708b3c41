/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Pushes a batch into the sink, retrying the whole batch until one pass succeeds.
 *
 * <p>A pass sends every record in order and then flushes the sink. Any exception from
 * {@code send} or {@code flush} fails the pass; the engine then sleeps for the current
 * backoff and starts again from the first record. There is no retry limit, so records
 * already written by a failed pass are written again.</p>
 */
public final class DeliveryEngine {

    private static final Logger log = LoggerFactory.getLogger(DeliveryEngine.class);

    private static final long FAILURE_LOG_INTERVAL_MS = 5_000L;

    static final String METRIC_LATENCY = "logsink.delivery.latency";
    static final String METRIC_RECORDS = "logsink.delivery.records";
    static final String METRIC_FAILURES = "logsink.delivery.failures";

    private final LogSink sink;
    private final BackoffPolicy backoff;
    private final PipelineCounters counters;
    private final MetricsRuntime metrics;
    private final Sleeper sleeper;
    private final RateLimitedLogger failureLog;

    public DeliveryEngine(LogSink sink, BackoffPolicy backoff, PipelineCounters counters,
                          MetricsRuntime metrics, Sleeper sleeper) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.counters = Objects.requireNonNull(counters, "counters");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.failureLog = new RateLimitedLogger(log, FAILURE_LOG_INTERVAL_MS);
    }

    /**
     * Returns once every record has been sent and flushed in a single pass.
     *
     * @throws InterruptedException if interrupted while sending or backing off
     */
    public void deliver(List<LogRecord> batch) throws InterruptedException {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) return;

        final long startNanos = System.nanoTime();
        Duration delay = backoff.initial();
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                sendPass(batch);
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                counters.recordRetry();
                metrics.counter(METRIC_FAILURES);
                failureLog.warn("Delivery to sink {} failed (batch={}, attempt={}), retrying in {}ms: {}",
                        sink.id(), batch.size(), attempt, delay.toMillis(), describe(e));
                sleeper.sleep(delay);
                delay = backoff.next(delay);
                continue;
            }

            counters.recordDelivered(batch.size());
            metrics.counter(METRIC_RECORDS, batch.size());
            metrics.timer(METRIC_LATENCY, (System.nanoTime() - startNanos) / 1_000_000L);
            if (attempt > 1) {
                log.info("Delivered batch of {} records to sink {} after {} attempts", batch.size(), sink.id(), attempt);
            }
            return;
        }
    }

    private void sendPass(List<LogRecord> batch) throws Exception {
        for (LogRecord record : batch) {
            sink.send(record);
        }
        sink.flush();
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getName() : e.getClass().getSimpleName() + ": " + msg;
    }
}
