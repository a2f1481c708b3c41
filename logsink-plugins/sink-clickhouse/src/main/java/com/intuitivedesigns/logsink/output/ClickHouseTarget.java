/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.output;

import com.intuitivedesigns.logsink.config.LogSinkEnv;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.config.SinkDsn;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Where and as whom a {@link ClickHouseLogSink} writes.
 *
 * @param url         HTTP base URL without trailing slash, e.g. {@code http://127.0.0.1:8123}
 * @param database    database name
 * @param table       table name
 * @param user        optional user, sent as {@code X-ClickHouse-User}
 * @param password    optional password, sent as {@code X-ClickHouse-Key}
 * @param serviceName optional service name; overrides the one carried by each record
 */
public record ClickHouseTarget(
        String url,
        String database,
        String table,
        String user,
        String password,
        String serviceName
) {

    public static final String KEY_SERVICE_NAME = "logsink.service.name";

    static final String DEFAULT_HOSTS = "127.0.0.1:8123";
    static final String DEFAULT_DATABASE = "default";
    static final String DEFAULT_TABLE = "logs";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public ClickHouseTarget {
        Objects.requireNonNull(url, "url");
        url = stripTrailingSlash(url.trim());
        database = identifier(database, "database");
        table = identifier(table, "table");
        user = blankToNull(user);
        password = blankToNull(password);
        serviceName = blankToNull(serviceName);
    }

    /**
     * Resolves a target from {@code clickhouse://[user[:pass]@]host:port/database/table}.
     * {@code LOG_SINK_CLICKHOUSE_*} variables, looked up through {@code env}, override the DSN parts.
     * The service name comes from {@value #KEY_SERVICE_NAME}, then {@code LOG_SINK_SERVICE_NAME}.
     */
    public static ClickHouseTarget resolve(SinkDsn dsn, PipelineConfig config, UnaryOperator<String> env) {
        Objects.requireNonNull(dsn, "dsn");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(env, "env");

        final String hosts = dsn.hosts().isBlank() ? DEFAULT_HOSTS : dsn.hosts();
        return new ClickHouseTarget(
                envOr(env, LogSinkEnv.LOG_SINK_CLICKHOUSE_URL, "http://" + hosts),
                envOr(env, LogSinkEnv.LOG_SINK_CLICKHOUSE_DB, dsn.segment(0, DEFAULT_DATABASE)),
                envOr(env, LogSinkEnv.LOG_SINK_CLICKHOUSE_TABLE, dsn.segment(1, DEFAULT_TABLE)),
                envOr(env, LogSinkEnv.LOG_SINK_CLICKHOUSE_USER, dsn.user().orElse(null)),
                envOr(env, LogSinkEnv.LOG_SINK_CLICKHOUSE_PASSWORD, dsn.password().orElse(null)),
                config.getString(KEY_SERVICE_NAME, envOr(env, LogSinkEnv.LOG_SINK_SERVICE_NAME, null)));
    }

    /** {@code database.table}, safe to splice into SQL. */
    public String qualifiedTable() {
        return database + "." + table;
    }

    @Override
    public String toString() {
        return "ClickHouseTarget{url=" + url + ", table=" + qualifiedTable()
                + ", user=" + user + ", serviceName=" + serviceName + "}";
    }

    private static String envOr(UnaryOperator<String> env, String key, String fallback) {
        String v = env.apply(key);
        return (v == null || v.isBlank()) ? fallback : v.trim();
    }

    private static String identifier(String value, String what) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid ClickHouse " + what + " name: '" + value + "'");
        }
        return value;
    }

    private static String stripTrailingSlash(String s) {
        String out = s;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
