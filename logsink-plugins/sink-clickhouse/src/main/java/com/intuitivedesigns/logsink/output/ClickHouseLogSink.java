/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.core.LogRecord;
import com.intuitivedesigns.logsink.core.LogRecordJson;
import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Inserts records into ClickHouse over its HTTP interface as {@code JSONEachRow}.
 *
 * Features:
 * - One POST per batch: {@link #send} buffers a row, {@link #flush} ships them all
 * - {@code fields} stored as a JSON string column
 * - Configured service name overrides the record's (shared-table setups)
 * - Optional schema check ({@code DESCRIBE TABLE}) and table creation from bundled DDL
 *
 * <p>The row buffer is cleared whether the POST succeeds or not; the pipeline resends the whole batch.
 * Buffer access is guarded by a lock held for the whole POST.</p>
 */
public final class ClickHouseLogSink implements LogSink {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseLogSink.class);

    // ---- Config keys ----
    public static final String KEY_CONNECT_TIMEOUT_MS = "logsink.clickhouse.connect.timeout.ms";
    public static final String KEY_REQUEST_TIMEOUT_MS = "logsink.clickhouse.request.timeout.ms";

    static final long DEFAULT_CONNECT_TIMEOUT_MS = 5_000L;
    static final long DEFAULT_REQUEST_TIMEOUT_MS = 10_000L;

    private static final String HEADER_USER = "X-ClickHouse-User";
    private static final String HEADER_KEY = "X-ClickHouse-Key";
    private static final int MAX_ERROR_BODY_CHARS = 512;

    /** Bundled DDL scripts. */
    public enum TableLayout {
        PER_SERVICE("clickhouse/per_service.sql"),
        SHARED("clickhouse/shared_table.sql");

        private final String resource;

        TableLayout(String resource) {
            this.resource = resource;
        }

        public static TableLayout fromString(String s) {
            return switch (s.trim().toUpperCase(Locale.ROOT).replace('-', '_')) {
                case "PER_SERVICE" -> PER_SERVICE;
                case "SHARED", "SHARED_TABLE" -> SHARED;
                default -> throw new IllegalArgumentException("Unknown ClickHouse table layout: '" + s + "'");
            };
        }
    }

    private final HttpClient client;
    private final ClickHouseTarget target;
    private final Duration requestTimeout;
    private final MetricsRuntime metrics;
    private final URI insertUri;
    private final List<String> rows = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    public ClickHouseLogSink(HttpClient client, ClickHouseTarget target, Duration requestTimeout, MetricsRuntime metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.target = Objects.requireNonNull(target, "target");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;
        this.insertUri = URI.create(target.url()
                + "/?database=" + encode(target.database())
                + "&date_time_input_format=best_effort"
                + "&input_format_skip_unknown_fields=1"
                + "&query=" + encode("INSERT INTO " + target.table() + " FORMAT JSONEachRow"));
        log.info("ClickHouseLogSink active. {}", target);
    }

    public static ClickHouseLogSink create(ClickHouseTarget target, PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        HttpClient client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(Math.max(1L, config.getLong(KEY_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS))))
                .build();
        Duration requestTimeout = Duration.ofMillis(Math.max(1L, config.getLong(KEY_REQUEST_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS)));
        return new ClickHouseLogSink(client, target, requestTimeout, metrics);
    }

    @Override
    public void send(LogRecord record) {
        final String row = toRow(Objects.requireNonNull(record, "record")).toString();
        lock.lock();
        try {
            rows.add(row);
        } finally {
            lock.unlock();
        }
    }

    ObjectNode toRow(LogRecord record) {
        ObjectNode row = LogRecordJson.mapper().createObjectNode();
        row.put("timestamp", record.timestamp().toString());
        row.put("level", record.level());
        row.put("target", record.target());
        row.put("module_path", record.modulePath());
        row.put("file", record.file());
        row.put("line", record.line());
        row.put("message", record.message());
        row.put("service_name", (target.serviceName() != null) ? target.serviceName() : record.serviceName());
        row.put("fields", LogRecordJson.fieldsJson(record.fields()));
        return row;
    }

    @Override
    public void flush() throws IOException, InterruptedException {
        lock.lock();
        try {
            if (!rows.isEmpty()) {
                flushInternal();
            }
        } finally {
            lock.unlock();
        }
    }

    private void flushInternal() throws IOException, InterruptedException {
        final int count = rows.size();
        final long start = System.nanoTime();
        try {
            StringBuilder body = new StringBuilder(count * 256);
            for (String row : rows) {
                body.append(row).append('\n');
            }
            HttpRequest request = request(insertUri)
                    .header("Content-Type", "application/x-ndjson; charset=utf-8")
                    .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
                    .build();
            execute(request, "insert into " + target.qualifiedTable());
        } catch (IOException e) {
            metrics.counter("logsink.clickhouse.errors", 1.0);
            throw e;
        } finally {
            rows.clear();
        }

        metrics.counter("logsink.clickhouse.rows", count);
        metrics.timer("logsink.clickhouse.latency", (System.nanoTime() - start) / 1_000_000);
    }

    /**
     * Checks that the target table exists.
     *
     * @return the table's column names, in declaration order
     * @throws IOException if the table is missing or the server cannot be reached
     */
    public List<String> validateSchema() throws IOException, InterruptedException {
        String query = "DESCRIBE TABLE " + target.qualifiedTable() + " FORMAT JSON";
        HttpRequest request = request(URI.create(target.url() + "/?query=" + encode(query))).GET().build();
        String body = execute(request, "schema validation of " + target.qualifiedTable());

        List<String> columns = new ArrayList<>();
        for (JsonNode column : LogRecordJson.mapper().readTree(body).path("data")) {
            columns.add(column.path("name").asText());
        }
        log.info("ClickHouse table {} has columns {}", target.qualifiedTable(), columns);
        return Collections.unmodifiableList(columns);
    }

    /**
     * Creates the target table from a bundled DDL script if it does not exist yet.
     */
    public void createTable(TableLayout layout) throws IOException, InterruptedException {
        Objects.requireNonNull(layout, "layout");
        String ddl = ddl(layout, target);
        HttpRequest request = request(URI.create(target.url() + "/"))
                .header("Content-Type", "text/plain; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(ddl, StandardCharsets.UTF_8))
                .build();
        execute(request, "create table " + target.qualifiedTable());
        log.info("ClickHouse table {} ensured (layout={})", target.qualifiedTable(), layout);
    }

    static String ddl(TableLayout layout, ClickHouseTarget target) throws IOException {
        try (InputStream in = ClickHouseLogSink.class.getClassLoader().getResourceAsStream(layout.resource)) {
            if (in == null) {
                throw new IOException("Missing bundled DDL resource " + layout.resource);
            }
            String template = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return template.replace("{database}", target.database()).replace("{table}", target.table());
        }
    }

    private HttpRequest.Builder request(URI uri) {
        HttpRequest.Builder b = HttpRequest.newBuilder(uri).timeout(requestTimeout);
        if (target.user() != null) b.header(HEADER_USER, target.user());
        if (target.password() != null) b.header(HEADER_KEY, target.password());
        return b;
    }

    private String execute(HttpRequest request, String what) throws IOException, InterruptedException {
        HttpResponse<String> resp = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("ClickHouse " + what + " failed with HTTP " + status + ": " + abbreviate(resp.body()));
        }
        return resp.body();
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String abbreviate(String s) {
        if (s == null) return "<no body>";
        String trimmed = s.trim();
        return (trimmed.length() <= MAX_ERROR_BODY_CHARS) ? trimmed : trimmed.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }

    public ClickHouseTarget target() {
        return target;
    }

    int pendingCount() {
        lock.lock();
        try {
            return rows.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String id() {
        return "clickhouse:" + target.qualifiedTable();
    }
}
