/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import com.intuitivedesigns.logsink.metrics.PipelineMetricsBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires queue, aggregator and delivery engine together and starts the single consumer thread.
 *
 * <p>The consumer runs {@code nextBatch -> deliver -> markFlushed} for the life of the JVM.
 * It is a daemon thread: records still buffered when the process exits are lost.</p>
 */
public final class PipelineSupervisor {

    private static final Logger log = LoggerFactory.getLogger(PipelineSupervisor.class);

    static final String THREAD_PREFIX = "logsink-pipeline-";

    private static final AtomicInteger SEQ = new AtomicInteger();

    private PipelineSupervisor() {}

    public static LogPipeline start(LogSink sink, PipelineSettings settings) {
        return start(sink, settings, MetricsRuntime.NOOP);
    }

    public static LogPipeline start(LogSink sink, PipelineSettings settings, MetricsRuntime metrics) {
        return start(sink, settings, metrics, Sleeper.SYSTEM);
    }

    public static LogPipeline start(LogSink sink, PipelineSettings settings, MetricsRuntime metrics, Sleeper sleeper) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(sleeper, "sleeper");
        final MetricsRuntime m = (metrics != null) ? metrics : MetricsRuntime.NOOP;

        final PipelineCounters counters = new PipelineCounters();
        final IngestionQueue queue = new IngestionQueue(settings.queueCapacity(), counters);
        final BatchAggregator aggregator = new BatchAggregator(queue, settings.batchSize(), settings.flushInterval());
        final DeliveryEngine engine = new DeliveryEngine(sink, settings.backoffPolicy(), counters, m, sleeper);

        final String name = THREAD_PREFIX + SEQ.incrementAndGet();
        final ConsumerLoop loop = new ConsumerLoop(name, sink.id(), aggregator, engine, sleeper, settings);
        final Thread thread = new Thread(loop, name);
        thread.setDaemon(true);

        final PipelineTask task = new PipelineTask(thread);
        final PipelineHandle handle = new PipelineHandle(queue, task);

        if (PipelineMetricsBinder.bind(m, handle)) {
            log.debug("Pipeline {} metrics bound to {}", name, m.type());
        }

        thread.start();
        log.info("Pipeline {} started: sink={} {}", name, sink.id(), settings);
        return new LogPipeline(handle, task);
    }

    private static final class ConsumerLoop implements Runnable {

        private final String name;
        private final String sinkId;
        private final BatchAggregator aggregator;
        private final DeliveryEngine engine;
        private final Sleeper sleeper;
        private final PipelineSettings settings;
        private final Logger echo;

        ConsumerLoop(String name, String sinkId, BatchAggregator aggregator, DeliveryEngine engine,
                     Sleeper sleeper, PipelineSettings settings) {
            this.name = name;
            this.sinkId = sinkId;
            this.aggregator = aggregator;
            this.engine = engine;
            this.sleeper = sleeper;
            this.settings = settings;
            this.echo = settings.echo() ? LoggerFactory.getLogger(PipelineSettings.ECHO_LOGGER) : null;
        }

        @Override
        public void run() {
            Batch inFlight = null;

            while (true) {
                try {
                    if (inFlight == null) {
                        inFlight = aggregator.nextBatch();
                        echo(inFlight);
                    }
                    engine.deliver(inFlight.records());
                    inFlight = null;
                    aggregator.markFlushed();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    final int lost = aggregator.pendingCount() + (inFlight != null ? inFlight.size() : 0);
                    log.warn("Pipeline {} interrupted, stopping. Undelivered records: {}", name, lost);
                    return;
                } catch (RuntimeException e) {
                    // Sink failures are handled inside the engine; anything here is unexpected.
                    // The in-flight batch is kept and handed to the engine again.
                    log.error("Pipeline {} loop error (sink={}), continuing", name, sinkId, e);
                    if (!pause()) return;
                }
            }
        }

        // Once per dequeued batch, not per delivery attempt
        private void echo(Batch batch) {
            if (echo == null || !echo.isInfoEnabled()) return;
            for (LogRecord r : batch.records()) {
                echo.info(LogRecordJson.toJson(r));
            }
        }

        private boolean pause() {
            try {
                sleeper.sleep(settings.initialBackoff());
                return true;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Pipeline {} interrupted, stopping", name);
                return false;
            }
        }
    }
}
