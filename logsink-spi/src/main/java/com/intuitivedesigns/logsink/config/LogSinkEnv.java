/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.config;

/**
 * Environment variable names understood by the bundled sinks and the app.
 * Sink types themselves never read the environment; their plugins do.
 */
public final class LogSinkEnv {

    /** Backend DSN, e.g. {@code postgres://user:pass@db:5432/logs}. */
    public static final String LOG_SINK_DSN = "LOG_SINK_DSN";

    /** Logical service name used in shared-table setups. */
    public static final String LOG_SINK_SERVICE_NAME = "LOG_SINK_SERVICE_NAME";

    /** ClickHouse base HTTP URL, e.g. {@code http://127.0.0.1:8123}. */
    public static final String LOG_SINK_CLICKHOUSE_URL = "LOG_SINK_CLICKHOUSE_URL";
    public static final String LOG_SINK_CLICKHOUSE_DB = "LOG_SINK_CLICKHOUSE_DB";
    public static final String LOG_SINK_CLICKHOUSE_TABLE = "LOG_SINK_CLICKHOUSE_TABLE";
    public static final String LOG_SINK_CLICKHOUSE_USER = "LOG_SINK_CLICKHOUSE_USER";
    public static final String LOG_SINK_CLICKHOUSE_PASSWORD = "LOG_SINK_CLICKHOUSE_PASSWORD";

    private LogSinkEnv() {}

    /**
     * @return the variable's value, or {@code defaultValue} when unset or blank.
     */
    public static String envOr(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }
}
