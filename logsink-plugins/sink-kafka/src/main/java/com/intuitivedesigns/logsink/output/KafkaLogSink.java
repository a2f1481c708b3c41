/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.output;

import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.config.SinkDsn;
import com.intuitivedesigns.logsink.core.LogRecord;
import com.intuitivedesigns.logsink.core.LogRecordJson;
import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Publishes each record as one JSON message.
 *
 * Features:
 * - Key = service name when set, else target (keeps a service's records on one partition)
 * - Synchronous send bounded by {@code logsink.kafka.send.timeout.ms}
 * - Rate-limited error logging
 * - Optional Micrometer counters/timer
 */
public final class KafkaLogSink implements LogSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaLogSink.class);

    // ---- Config keys ----
    public static final String KEY_BOOTSTRAP = "logsink.kafka.bootstrap.servers";
    public static final String KEY_TOPIC = "logsink.kafka.topic";
    public static final String KEY_SEND_TIMEOUT_MS = "logsink.kafka.send.timeout.ms";
    static final String KEY_CLIENT_ID = "logsink.kafka.client.id";
    static final String KEY_ACKS = "logsink.kafka.acks";
    static final String KEY_COMPRESSION = "logsink.kafka.compression";
    static final String KEY_LINGER_MS = "logsink.kafka.linger.ms";
    private static final String PASSTHROUGH_PREFIX = "logsink.kafka.";

    // ---- Defaults ----
    public static final String DEFAULT_TOPIC = "logs";
    public static final long DEFAULT_SEND_TIMEOUT_MS = 5_000L;
    private static final String DEFAULT_BOOTSTRAP = "localhost:9092";
    private static final long ERROR_LOG_INTERVAL_MS = 1_000L;

    private final Producer<String, String> producer;
    private final String topic;
    private final long sendTimeoutMs;

    // Fast counters (always on)
    private final LongAdder sentOk = new LongAdder();
    private final LongAdder sentFail = new LongAdder();

    // Micrometer (optional)
    private final Counter okCounter;
    private final Counter failCounter;
    private final Timer sendLatencyTimer;

    // Rate-limited error logging
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public KafkaLogSink(Producer<String, String> producer, String topic, long sendTimeoutMs, MetricsRuntime metrics) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.sendTimeoutMs = Math.max(1L, sendTimeoutMs);

        MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr)
                ? mr
                : null;

        if (registry != null) {
            this.okCounter = registry.counter("logsink.kafka.send.ok", "topic", topic);
            this.failCounter = registry.counter("logsink.kafka.send.fail", "topic", topic);
            this.sendLatencyTimer = registry.timer("logsink.kafka.send.latency", "topic", topic);
        } else {
            this.okCounter = null;
            this.failCounter = null;
            this.sendLatencyTimer = null;
        }

        log.info("KafkaLogSink active. topic='{}' sendTimeoutMs={}", topic, this.sendTimeoutMs);
    }

    /**
     * {@code kafka://broker1:9092,broker2:9092/topic}; the topic defaults to {@value #DEFAULT_TOPIC}.
     */
    public static KafkaLogSink fromDsn(SinkDsn dsn, PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(dsn, "dsn");
        Objects.requireNonNull(config, "config");

        final String bootstrap = dsn.hosts().isBlank()
                ? config.getString(KEY_BOOTSTRAP, DEFAULT_BOOTSTRAP)
                : dsn.hosts();
        final String topic = dsn.segment(0, config.getString(KEY_TOPIC, DEFAULT_TOPIC));
        final long timeoutMs = config.getLong(KEY_SEND_TIMEOUT_MS, DEFAULT_SEND_TIMEOUT_MS);

        final Properties props = buildProducerProps(bootstrap, timeoutMs, config);
        return new KafkaLogSink(new KafkaProducer<>(props), topic, timeoutMs, metrics);
    }

    static Properties buildProducerProps(String bootstrap, long sendTimeoutMs, PipelineConfig config) {
        final Properties props = new Properties();

        // Connectivity
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, config.getString(KEY_CLIENT_ID, "logsink"));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        // Durability: the pipeline retries failed batches itself
        props.put(ProducerConfig.ACKS_CONFIG, config.getString(KEY_ACKS, "1"));

        // Performance
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, config.getString(KEY_COMPRESSION, "lz4"));
        props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.toString(config.getInt(KEY_LINGER_MS, 5)));

        // send() must not block on metadata longer than a whole send is allowed to take
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, Long.toString(Math.max(1L, sendTimeoutMs)));

        // Security passthrough: logsink.kafka.ssl.*, .security.*, .sasl.* -> strip "logsink.kafka."
        for (String key : config.keys()) {
            if (key.startsWith(PASSTHROUGH_PREFIX + "ssl.")
                    || key.startsWith(PASSTHROUGH_PREFIX + "security.")
                    || key.startsWith(PASSTHROUGH_PREFIX + "sasl.")) {
                String v = config.getString(key, null);
                if (v != null) props.put(key.substring(PASSTHROUGH_PREFIX.length()), v);
            }
        }
        return props;
    }

    @Override
    public void send(LogRecord record) throws Exception {
        Objects.requireNonNull(record, "record");
        final String key = (record.serviceName() != null) ? record.serviceName() : record.target();
        final ProducerRecord<String, String> message = new ProducerRecord<>(topic, key, LogRecordJson.toJson(record));

        final long startNs = System.nanoTime();
        try {
            producer.send(message).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            markOk(startNs);
        } catch (ExecutionException e) {
            final Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            markFail(startNs, cause);
            if (cause instanceof Exception ex) throw ex;
            throw e;
        } catch (TimeoutException e) {
            markFail(startNs, e);
            throw new TimeoutException("Kafka send to topic '" + topic + "' timed out after " + sendTimeoutMs + "ms");
        } catch (RuntimeException e) {
            markFail(startNs, e);
            throw e;
        }
    }

    @Override
    public void flush() {
        producer.flush();
    }

    @Override
    public String id() {
        return "kafka:" + topic;
    }

    // ---- Metrics & Logging ----

    private void markOk(long startNanos) {
        sentOk.increment();
        if (okCounter != null) okCounter.increment();
        if (sendLatencyTimer != null) sendLatencyTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void markFail(long startNanos, Throwable exception) {
        sentFail.increment();
        if (failCounter != null) failCounter.increment();
        if (sendLatencyTimer != null) sendLatencyTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        logRateLimited("Kafka send failed topic=" + topic, exception);
    }

    private void logRateLimited(String context, Throwable ex) {
        long now = System.currentTimeMillis();
        long last = lastErrorLogMs.get();

        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.warn("{} (suppressed {} similar errors): {}", context, suppressed, ex.getMessage());
            } else {
                log.warn("{}: {}", context, ex.getMessage());
            }
        } else {
            suppressedErrorLogs.increment();
        }
    }

    // ---- Introspection ----

    public long sentOkTotal() { return sentOk.sum(); }

    public long sentFailTotal() { return sentFail.sum(); }

    public String topic() { return topic; }

    // ---- Lifecycle ----

    @Override
    public void close() {
        log.info("Closing KafkaLogSink (topic={})...", topic);
        producer.flush();
        producer.close(Duration.ofSeconds(5));
    }
}
