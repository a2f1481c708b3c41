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
import com.intuitivedesigns.logsink.output.KafkaLogSink;
import com.intuitivedesigns.logsink.spi.SinkPlugin;

public final class KafkaSinkPlugin implements SinkPlugin {

    @Override
    public BackendKind kind() {
        return BackendKind.KAFKA;
    }

    @Override
    public LogSink create(SinkDsn dsn, PipelineConfig config, MetricsRuntime metrics) {
        return KafkaLogSink.fromDsn(dsn, config, metrics);
    }
}
