/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.core.LogRecord;
import com.intuitivedesigns.logsink.core.LogRecordJson;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import com.intuitivedesigns.logsink.metrics.MicrometerMetricsRuntime;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class KafkaLogSinkTest {

    private static MockProducer<String, String> producer(boolean autoComplete) {
        return new MockProducer<>(autoComplete, new StringSerializer(), new StringSerializer());
    }

    @Test
    void testRecordIsSentAsJsonKeyedByTarget() throws Exception {
        MockProducer<String, String> producer = producer(true);
        KafkaLogSink sink = new KafkaLogSink(producer, "app-logs", 5_000, MetricsRuntime.NOOP);

        sink.send(LogRecord.builder("ERROR", "payments").message("card declined").field("amount", 12.5).build());

        assertEquals(1, producer.history().size());
        ProducerRecord<String, String> sent = producer.history().get(0);
        assertEquals("app-logs", sent.topic());
        assertEquals("payments", sent.key());

        JsonNode json = LogRecordJson.mapper().readTree(sent.value());
        assertEquals("card declined", json.get("message").asText());
        assertEquals(12.5, json.get("fields").get("amount").asDouble());
        assertEquals(1, sink.sentOkTotal());
    }

    @Test
    void testServiceNameIsPreferredAsKey() throws Exception {
        MockProducer<String, String> producer = producer(true);
        KafkaLogSink sink = new KafkaLogSink(producer, "logs", 5_000, MetricsRuntime.NOOP);

        sink.send(LogRecord.builder("ERROR", "db").serviceName("orders").build());

        assertEquals("orders", producer.history().get(0).key());
    }

    @Test
    void testBrokerFailureSurfacesToCaller() {
        MockProducer<String, String> producer = producer(true);
        producer.sendException = new KafkaException("broker unavailable");
        KafkaLogSink sink = new KafkaLogSink(producer, "logs", 5_000, MetricsRuntime.NOOP);

        assertThrows(KafkaException.class, () -> sink.send(LogRecord.builder("ERROR", "t").build()));
        assertEquals(1, sink.sentFailTotal());
    }

    @Test
    void testSendIsBoundedByTimeout() {
        // Never acknowledged
        KafkaLogSink sink = new KafkaLogSink(producer(false), "logs", 50, MetricsRuntime.NOOP);

        assertThrows(TimeoutException.class, () -> sink.send(LogRecord.builder("ERROR", "t").build()));
        assertEquals(1, sink.sentFailTotal());
    }

    @Test
    void testFlushAndMetrics() throws Exception {
        MockProducer<String, String> producer = producer(true);
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        KafkaLogSink sink = new KafkaLogSink(producer, "logs", 5_000, metrics);

        sink.send(LogRecord.builder("ERROR", "t").build());
        sink.flush();

        MeterRegistry registry = metrics.registry();
        assertEquals(1.0, registry.get("logsink.kafka.send.ok").tag("topic", "logs").counter().count());
        assertEquals("kafka:logs", sink.id());
    }

    @Test
    void testProducerPropsFromConfig() {
        PipelineConfig config = PipelineConfig.of(Map.of(
                "logsink.kafka.acks", "all",
                "logsink.kafka.security.protocol", "SASL_SSL",
                "logsink.kafka.sasl.mechanism", "PLAIN",
                "logsink.kafka.topic", "ignored-here"));

        Properties props = KafkaLogSink.buildProducerProps("b1:9092,b2:9092", 2_000, config);

        assertEquals("b1:9092,b2:9092", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("all", props.get(ProducerConfig.ACKS_CONFIG));
        assertEquals("2000", props.get(ProducerConfig.MAX_BLOCK_MS_CONFIG));
        assertEquals("SASL_SSL", props.get("security.protocol"));
        assertEquals("PLAIN", props.get("sasl.mechanism"));
        assertFalse(props.containsKey("topic"));
    }
}
