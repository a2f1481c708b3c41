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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ClickHouseLogSinkTest {

    private StubHttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private ClickHouseLogSink sink(String user, String password, String serviceName) {
        ClickHouseTarget target = new ClickHouseTarget(server.baseUrl() + "/", "default", "logs", user, password, serviceName);
        return ClickHouseLogSink.create(target, PipelineConfig.empty(), MetricsRuntime.NOOP);
    }

    @Test
    void testFlushPostsOneJsonEachRowBody() throws Exception {
        ClickHouseLogSink sink = sink("writer", "s3cret", null);

        sink.send(LogRecord.builder("ERROR", "auth")
                .timestamp(Instant.parse("2025-03-01T12:00:00Z"))
                .message("denied")
                .field("user_id", 42)
                .serviceName("gateway")
                .build());
        sink.send(LogRecord.builder("ERROR", "db").line(9).build());
        assertTrue(server.requests.isEmpty(), "send only buffers");

        sink.flush();

        assertEquals(1, server.requests.size());
        StubHttpServer.Request req = server.last();
        assertEquals("POST", req.method());
        assertTrue(req.rawQuery().contains("database=default"), req.rawQuery());
        assertTrue(req.rawQuery().contains("query=INSERT%20INTO%20logs%20FORMAT%20JSONEachRow"), req.rawQuery());
        assertEquals("writer", req.header("X-ClickHouse-User"));
        assertEquals("s3cret", req.header("X-ClickHouse-Key"));

        String[] lines = req.body().split("\n");
        assertEquals(2, lines.length);

        JsonNode first = LogRecordJson.mapper().readTree(lines[0]);
        assertEquals("2025-03-01T12:00:00Z", first.get("timestamp").asText());
        assertEquals("auth", first.get("target").asText());
        assertEquals("denied", first.get("message").asText());
        assertEquals("gateway", first.get("service_name").asText());
        assertTrue(first.get("fields").isTextual(), "fields travel as a JSON string");
        assertEquals("{\"user_id\":42}", first.get("fields").asText());

        JsonNode second = LogRecordJson.mapper().readTree(lines[1]);
        assertEquals(9, second.get("line").asInt());
        assertTrue(second.get("message").isNull());
        assertEquals(0, sink.pendingCount());
    }

    @Test
    void testConfiguredServiceNameOverridesRecord() throws Exception {
        ClickHouseLogSink sink = sink(null, null, "billing");

        sink.send(LogRecord.builder("ERROR", "t").serviceName("other").build());
        sink.flush();

        JsonNode row = LogRecordJson.mapper().readTree(server.last().body().trim());
        assertEquals("billing", row.get("service_name").asText());
        assertNull(server.last().header("X-ClickHouse-User"));
    }

    @Test
    void testServerErrorFailsFlushAndClearsRows() {
        server.status = 500;
        server.responseBody = "Code: 60. DB::Exception: Table default.logs does not exist";
        ClickHouseLogSink sink = sink(null, null, null);

        sink.send(LogRecord.builder("ERROR", "t").build());
        IOException ex = assertThrows(IOException.class, sink::flush);

        assertTrue(ex.getMessage().contains("HTTP 500"), ex.getMessage());
        assertTrue(ex.getMessage().contains("does not exist"), ex.getMessage());
        assertEquals(0, sink.pendingCount());
    }

    @Test
    void testEmptyFlushSendsNothing() throws Exception {
        sink(null, null, null).flush();
        assertTrue(server.requests.isEmpty());
    }

    @Test
    void testValidateSchemaDescribesTable() throws Exception {
        server.responseBody = "{\"meta\":[],\"data\":[{\"name\":\"timestamp\",\"type\":\"DateTime64(3, 'UTC')\"},"
                + "{\"name\":\"level\",\"type\":\"String\"}],\"rows\":2}";
        ClickHouseLogSink sink = sink(null, null, null);

        List<String> columns = sink.validateSchema();

        assertEquals(List.of("timestamp", "level"), columns);
        assertEquals("GET", server.last().method());
        assertEquals("query=DESCRIBE%20TABLE%20default.logs%20FORMAT%20JSON", server.last().rawQuery());
    }

    @Test
    void testValidateSchemaFailsOnMissingTable() {
        server.status = 404;
        assertThrows(IOException.class, () -> sink(null, null, null).validateSchema());
    }

    @Test
    void testCreateTableUsesBundledDdl() throws Exception {
        ClickHouseLogSink sink = sink(null, null, null);

        sink.createTable(ClickHouseLogSink.TableLayout.SHARED);

        String ddl = server.last().body();
        assertTrue(ddl.contains("CREATE TABLE IF NOT EXISTS default.logs"), ddl);
        assertTrue(ddl.contains("service_name"), ddl);
        assertFalse(ddl.contains("{database}"));
    }

    @Test
    void testPerServiceDdlHasNoServiceColumn() throws Exception {
        ClickHouseTarget target = new ClickHouseTarget("http://localhost:8123", "analytics", "api_errors", null, null, null);

        String ddl = ClickHouseLogSink.ddl(ClickHouseLogSink.TableLayout.PER_SERVICE, target);

        assertTrue(ddl.contains("analytics.api_errors"));
        assertFalse(ddl.contains("service_name"));
        assertEquals(ClickHouseLogSink.TableLayout.SHARED, ClickHouseLogSink.TableLayout.fromString("shared-table"));
    }

    @Test
    void testConcurrentSendersShareOneBuffer() throws Exception {
        ClickHouseLogSink sink = sink(null, null, null);

        final int producers = 4;
        final int perProducer = 100;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        try {
            Future<?>[] sends = new Future<?>[producers];
            for (int p = 0; p < producers; p++) {
                sends[p] = pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perProducer; i++) {
                        sink.send(LogRecord.builder("ERROR", "load").message("m" + i).build());
                        if (i % 25 == 0) sink.flush();
                    }
                    return null;
                });
            }
            go.countDown();
            for (Future<?> f : sends) f.get(20, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        sink.flush();

        long rows = server.requests.stream()
                .mapToLong(r -> r.body().lines().filter(l -> !l.isBlank()).count())
                .sum();
        assertEquals(producers * perProducer, rows);
        assertEquals(0, sink.pendingCount());
    }
}
