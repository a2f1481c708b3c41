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
import com.intuitivedesigns.logsink.output.PostgresLogSink;
import com.intuitivedesigns.logsink.spi.SinkPlugin;

public final class PostgresSinkPlugin implements SinkPlugin {

    @Override
    public BackendKind kind() {
        return BackendKind.POSTGRES;
    }

    @Override
    public LogSink create(SinkDsn dsn, PipelineConfig config, MetricsRuntime metrics) {
        return PostgresLogSink.fromDsn(dsn, config, metrics);
    }
}
