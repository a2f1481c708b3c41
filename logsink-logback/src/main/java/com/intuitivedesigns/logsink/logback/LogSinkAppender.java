/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.config.SinkFactory;
import com.intuitivedesigns.logsink.core.LogPipeline;
import com.intuitivedesigns.logsink.core.LogRecord;
import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.core.PipelineSettings;
import com.intuitivedesigns.logsink.core.PipelineSupervisor;
import com.intuitivedesigns.logsink.core.RecordTranslator;
import com.intuitivedesigns.logsink.core.SourceLocation;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import org.slf4j.event.KeyValuePair;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Logback bridge: forwards qualifying events into a LogSink pipeline.
 *
 * <pre>{@code
 * <appender name="LOGSINK" class="com.intuitivedesigns.logsink.logback.LogSinkAppender">
 *   <dsn>clickhouse://127.0.0.1:8123/default/logs</dsn>
 *   <serviceName>billing</serviceName>
 *   <minimumLevel>ERROR</minimumLevel>
 * </appender>
 * }</pre>
 *
 * <p>Fields are taken from the MDC, then SLF4J key/value pairs (which win on conflict).
 * Events logged on the pipeline thread and events from excluded logger prefixes are skipped,
 * so a failing sink cannot feed its own errors back into the queue.</p>
 *
 * <p>Logging threads are not serialized on the appender: each one translates its own event and
 * hands it to the pipeline's non-blocking queue.</p>
 *
 * <p>{@link #stop()} only stops accepting events: the pipeline keeps delivering until the JVM exits.</p>
 */
public class LogSinkAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    static final String DEFAULT_EXCLUDED_PREFIXES =
            "com.intuitivedesigns.logsink,org.apache.kafka,com.zaxxer.hikari,org.postgresql";

    private String dsn;
    private LogSink sink;
    private String serviceName;
    private String minimumLevel = RecordTranslator.Severity.ERROR.name();
    private String excludedPrefixes = DEFAULT_EXCLUDED_PREFIXES;
    private boolean includeCallerData = true;
    private boolean includeMdc = true;

    private int queueCapacity = PipelineSettings.DEFAULT_QUEUE_CAPACITY;
    private int batchSize = PipelineSettings.DEFAULT_BATCH_SIZE;
    private long flushIntervalMs = PipelineSettings.DEFAULT_FLUSH_INTERVAL.toMillis();
    private long initialBackoffMs = PipelineSettings.DEFAULT_INITIAL_BACKOFF.toMillis();
    private long maxBackoffMs = PipelineSettings.DEFAULT_MAX_BACKOFF.toMillis();

    private RecordTranslator translator;
    private List<String> excluded = List.of();
    private volatile LogPipeline pipeline;

    @Override
    public void start() {
        if (isStarted()) return;

        final RecordTranslator.Severity minimum = RecordTranslator.Severity.parse(minimumLevel).orElse(null);
        if (minimum == null) {
            addError("Unknown minimumLevel '" + minimumLevel + "' for appender " + getName());
            return;
        }
        translator = RecordTranslator.builder()
                .minimumLevel(minimum)
                .serviceName(serviceName)
                .build();
        excluded = splitPrefixes(excludedPrefixes);

        if (pipeline == null) {
            final LogSink target;
            try {
                target = resolveSink();
            } catch (RuntimeException e) {
                addError("Failed to build LogSink backend for appender " + getName(), e);
                return;
            }
            try {
                PipelineSettings settings = PipelineSettings.builder()
                        .queueCapacity(queueCapacity)
                        .batchSize(batchSize)
                        .flushInterval(Duration.ofMillis(flushIntervalMs))
                        .initialBackoff(Duration.ofMillis(initialBackoffMs))
                        .maxBackoff(Duration.ofMillis(maxBackoffMs))
                        .build();
                pipeline = PipelineSupervisor.start(target, settings, MetricsRuntime.NOOP);
                addInfo("LogSink pipeline started: sink=" + target.id() + ", " + settings);
            } catch (RuntimeException e) {
                addError("Failed to start LogSink pipeline for appender " + getName(), e);
                return;
            }
        }
        super.start();
    }

    private LogSink resolveSink() {
        if (sink != null) return sink;
        if (dsn != null && !dsn.isBlank()) {
            return SinkFactory.fromDsn(dsn.trim(), PipelineConfig.get(), MetricsRuntime.NOOP);
        }
        return SinkFactory.fromConfig(PipelineConfig.get(), MetricsRuntime.NOOP);
    }

    @Override
    protected void append(ILoggingEvent event) {
        final LogPipeline p = pipeline;
        if (p == null || p.task().isCurrentThread()) return;
        if (!translator.accepts(event.getLevel().toString())) return;
        if (isExcluded(event.getLoggerName())) return;

        p.offer(translator.translate(
                event.getLevel().toString(),
                event.getLoggerName(),
                values(event),
                includeCallerData ? location(event) : SourceLocation.unknown(),
                Instant.ofEpochMilli(event.getTimeStamp())));
    }

    private Map<String, Object> values(ILoggingEvent event) {
        final Map<String, Object> values = new LinkedHashMap<>();
        if (includeMdc) {
            values.putAll(event.getMDCPropertyMap());
        }
        final List<KeyValuePair> kvs = event.getKeyValuePairs();
        if (kvs != null) {
            for (KeyValuePair kv : kvs) {
                if (kv != null && kv.key != null) values.put(kv.key, kv.value);
            }
        }
        final IThrowableProxy error = event.getThrowableProxy();
        if (error != null) {
            values.put("exception.class", error.getClassName());
            values.put("exception.message", error.getMessage());
        }
        // Formatted message always owns the message slot
        values.put(LogRecord.MESSAGE_KEY, event.getFormattedMessage());
        return values;
    }

    private static SourceLocation location(ILoggingEvent event) {
        final StackTraceElement[] callerData = event.getCallerData();
        if (callerData == null || callerData.length == 0) return SourceLocation.unknown();
        final StackTraceElement top = callerData[0];
        final Integer line = (top.getLineNumber() > 0) ? top.getLineNumber() : null;
        return new SourceLocation(top.getClassName(), top.getFileName(), line);
    }

    private boolean isExcluded(String loggerName) {
        if (loggerName == null) return false;
        for (String prefix : excluded) {
            if (loggerName.equals(prefix) || loggerName.startsWith(prefix + ".")) return true;
        }
        return false;
    }

    static List<String> splitPrefixes(String csv) {
        final List<String> out = new ArrayList<>();
        if (csv == null) return out;
        for (String s : csv.split(",")) {
            final String t = s.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return List.copyOf(out);
    }

    /** The running pipeline, or null before a successful {@link #start()}. */
    public LogPipeline getPipeline() {
        return pipeline;
    }

    // ---- Properties (Joran) ----

    public void setDsn(String dsn) { this.dsn = dsn; }

    /** Uses this sink instead of building one from {@code dsn}. */
    public void setSink(LogSink sink) { this.sink = sink; }

    public void setServiceName(String serviceName) { this.serviceName = serviceName; }

    public void setMinimumLevel(String minimumLevel) {
        this.minimumLevel = (minimumLevel == null) ? null : minimumLevel.trim().toUpperCase(Locale.ROOT);
    }

    /** Comma separated logger-name prefixes that are never forwarded. */
    public void setExcludedPrefixes(String excludedPrefixes) { this.excludedPrefixes = excludedPrefixes; }

    public void setIncludeCallerData(boolean includeCallerData) { this.includeCallerData = includeCallerData; }

    public void setIncludeMdc(boolean includeMdc) { this.includeMdc = includeMdc; }

    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public void setFlushIntervalMs(long flushIntervalMs) { this.flushIntervalMs = flushIntervalMs; }

    public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

    public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
}
