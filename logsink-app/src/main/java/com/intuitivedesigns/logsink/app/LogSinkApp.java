/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.app;

import com.intuitivedesigns.logsink.config.LogSinkEnv;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.config.SinkFactory;
import com.intuitivedesigns.logsink.core.CountersSnapshot;
import com.intuitivedesigns.logsink.core.LogPipeline;
import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.core.PipelineSettings;
import com.intuitivedesigns.logsink.core.PipelineSupervisor;
import com.intuitivedesigns.logsink.core.RecordTranslator;
import com.intuitivedesigns.logsink.core.SourceLocation;
import com.intuitivedesigns.logsink.metrics.MetricsFactory;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Load generator: pushes synthetic error events through a pipeline and reports throughput.
 *
 * <p>Backend from {@code logsink.dsn} / {@code LOG_SINK_DSN} (default {@code noop://}).</p>
 */
public final class LogSinkApp {

    private static final Logger log = LoggerFactory.getLogger(LogSinkApp.class);

    // --- Config Keys ---
    static final String CFG_EVENTS = "logsink.load.events";
    static final String CFG_LINGER_MS = "logsink.load.linger.ms";
    static final String CFG_SERVICE_NAME = "logsink.service.name";
    private static final String CFG_SPEEDOMETER_ENABLED = "logsink.speedometer.enabled";
    private static final String CFG_SPEEDOMETER_WINDOW_SECONDS = "logsink.speedometer.window.seconds";

    // --- Defaults ---
    private static final long DEFAULT_EVENTS = 100_000L;
    private static final long DEFAULT_LINGER_MS = 2_000L;
    private static final int DEFAULT_WINDOW_SECONDS = 5;
    private static final int MIN_WINDOW_SECONDS = 1;
    private static final int MAX_WINDOW_SECONDS = 60;
    private static final long DRAIN_POLL_MS = 20L;

    static final String LOAD_TARGET = "logsink.load";

    /**
     * Outcome of one load run.
     *
     * @param events   events offered
     * @param elapsed  time spent offering
     * @param counters pipeline counters after the linger period
     * @param drained  true if every accepted event was delivered before the linger ran out
     */
    public record LoadReport(long events, Duration elapsed, CountersSnapshot counters, boolean drained) {

        public double eventsPerSecond() {
            final double seconds = Math.max(1L, elapsed.toNanos()) / 1_000_000_000.0;
            return events / seconds;
        }
    }

    private LogSinkApp() {}

    public static void main(String[] args) {
        log.info("=== Booting LogSink load generator ===");

        final PipelineConfig config = PipelineConfig.get();
        SinkFactory.logAvailablePlugins();

        MetricsRuntime metrics = null;
        LogSink sink = null;
        try {
            metrics = MetricsFactory.init(config);
            sink = SinkFactory.fromConfig(config, metrics);

            final MetricsRuntime finalMetrics = metrics;
            final LogSink finalSink = sink;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown signal received.");
                closeLogged(finalSink);
                closeLogged(finalMetrics);
            }, "logsink-shutdown"));

            LoadReport report = run(config, sink, metrics);
            if (!report.drained()) {
                log.warn("Backlog not drained after linger: {} accepted records were not delivered",
                        report.counters().enqueued() - report.counters().delivered());
            }
        } catch (Exception e) {
            log.error("Fatal application error", e);
            closeLogged(sink);
            closeLogged(metrics);
            System.exit(1);
        }
    }

    /**
     * Starts a pipeline on {@code sink}, offers {@value #CFG_EVENTS} events as fast as possible,
     * then waits up to {@value #CFG_LINGER_MS} for the backlog to drain.
     */
    public static LoadReport run(PipelineConfig config, LogSink sink, MetricsRuntime metrics) throws InterruptedException {
        final long events = Math.max(0L, config.getLong(CFG_EVENTS, DEFAULT_EVENTS));
        final long lingerMs = Math.max(0L, config.getLong(CFG_LINGER_MS, DEFAULT_LINGER_MS));
        final boolean speedometerEnabled = config.getBoolean(CFG_SPEEDOMETER_ENABLED, false);
        final int windowSeconds = clampInt(
                config.getInt(CFG_SPEEDOMETER_WINDOW_SECONDS, DEFAULT_WINDOW_SECONDS),
                MIN_WINDOW_SECONDS,
                MAX_WINDOW_SECONDS
        );

        final PipelineSettings settings = PipelineSettings.fromConfig(config);
        final RecordTranslator translator = RecordTranslator.builder()
                .serviceName(config.getString(CFG_SERVICE_NAME, LogSinkEnv.envOr(LogSinkEnv.LOG_SINK_SERVICE_NAME, null)))
                .build();

        log.info("CONFIG: events={} | linger={}ms | sink={} | {}", events, lingerMs, sink.id(), settings);
        final LogPipeline pipeline = PipelineSupervisor.start(sink, settings, metrics);

        ScheduledExecutorService speedometer = null;
        if (speedometerEnabled) {
            speedometer = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("logsink-speedometer"));
            startSpeedometer(speedometer, pipeline, windowSeconds);
        }

        try {
            final long startNs = System.nanoTime();
            for (long i = 0; i < events; i++) {
                final Map<String, Object> values = new LinkedHashMap<>();
                values.put("iteration", i);
                values.put("message", "load test error");
                pipeline.offer(translator.translate("ERROR", LOAD_TARGET, values, SourceLocation.unknown()));
            }
            final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNs);

            log.info(String.format(Locale.US, "Offered %,d events in %d ms (~%,.0f ev/s)",
                    events, elapsed.toMillis(), events / Math.max(1e-9, elapsed.toNanos() / 1_000_000_000.0)));

            final boolean drained = awaitDrained(pipeline, lingerMs);
            final CountersSnapshot counters = pipeline.counters();
            log.info("Counters: {}", counters);
            return new LoadReport(events, elapsed, counters, drained);
        } finally {
            if (speedometer != null) {
                speedometer.shutdownNow();
            }
        }
    }

    private static boolean awaitDrained(LogPipeline pipeline, long lingerMs) throws InterruptedException {
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(lingerMs);
        while (true) {
            final CountersSnapshot c = pipeline.counters();
            if (c.delivered() >= c.enqueued()) return true;
            if (System.nanoTime() >= deadline) return false;
            TimeUnit.MILLISECONDS.sleep(DRAIN_POLL_MS);
        }
    }

    private static void startSpeedometer(ScheduledExecutorService scheduler, LogPipeline pipeline, int windowSeconds) {
        log.info("Speedometer active ({}s window)", windowSeconds);

        final long periodNs = TimeUnit.SECONDS.toNanos(windowSeconds);

        scheduler.scheduleAtFixedRate(new Runnable() {
            private long lastTimeNs = System.nanoTime();
            private long lastObserved = 0;
            private long lastDelivered = 0;

            @Override
            public void run() {
                try {
                    final long nowNs = System.nanoTime();
                    final long elapsedNs = nowNs - lastTimeNs;
                    if (elapsedNs <= 0) {
                        return;
                    }
                    final double seconds = elapsedNs / 1_000_000_000.0;
                    final CountersSnapshot c = pipeline.counters();

                    log.info(String.format(
                            Locale.US,
                            "AVG %ds | OFFERED: %,.0f eps | DELIVERED: %,.0f eps | DROPPED: %,d | RETRIES: %,d",
                            windowSeconds,
                            (c.observed() - lastObserved) / seconds,
                            (c.delivered() - lastDelivered) / seconds,
                            c.dropped(),
                            c.retries()
                    ));

                    lastObserved = c.observed();
                    lastDelivered = c.delivered();
                    lastTimeNs = nowNs;
                } catch (RuntimeException e) {
                    log.warn("Speedometer error", e);
                }
            }
        }, periodNs, periodNs, TimeUnit.NANOSECONDS);
    }

    private static void closeLogged(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close {}: {}", resource, e.getMessage());
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
