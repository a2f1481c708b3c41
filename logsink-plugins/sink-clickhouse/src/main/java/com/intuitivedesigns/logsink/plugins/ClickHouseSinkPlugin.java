/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.plugins;

import com.intuitivedesigns.logsink.config.BackendKind;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.config.SinkDsn;
import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import com.intuitivedesigns.logsink.output.ClickHouseLogSink;
import com.intuitivedesigns.logsink.output.ClickHouseTarget;
import com.intuitivedesigns.logsink.spi.SinkPlugin;

/**
 * {@code clickhouse://} backend.
 *
 * <p>Optional startup steps, both off by default:</p>
 * <ul>
 * <li>{@code logsink.clickhouse.create.table=per_service|shared} creates the table from bundled DDL</li>
 * <li>{@code logsink.clickhouse.validate.schema=true} fails the build when the table is missing</li>
 * </ul>
 */
public final class ClickHouseSinkPlugin implements SinkPlugin {

    static final String KEY_CREATE_TABLE = "logsink.clickhouse.create.table";
    static final String KEY_VALIDATE_SCHEMA = "logsink.clickhouse.validate.schema";

    @Override
    public BackendKind kind() {
        return BackendKind.CLICKHOUSE;
    }

    @Override
    public LogSink create(SinkDsn dsn, PipelineConfig config, MetricsRuntime metrics) throws Exception {
        ClickHouseTarget target = ClickHouseTarget.resolve(dsn, config, System::getenv);
        ClickHouseLogSink sink = ClickHouseLogSink.create(target, config, metrics);

        String layout = config.getString(KEY_CREATE_TABLE, "");
        if (!layout.isBlank()) {
            sink.createTable(ClickHouseLogSink.TableLayout.fromString(layout));
        }
        if (config.getBoolean(KEY_VALIDATE_SCHEMA, false)) {
            sink.validateSchema();
        }
        return sink;
    }
}
