/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.plugins;

import com.intuitivedesigns.logsink.config.BackendKind;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.config.SinkDsn;
import com.intuitivedesigns.logsink.core.LogRecord;
import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import com.intuitivedesigns.logsink.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 'Black hole' backend ({@code noop://}) for benchmarks and tests. Discards every record.
 */
public final class NoopSinkPlugin implements SinkPlugin {

    private static final Logger log = LoggerFactory.getLogger(NoopSinkPlugin.class);

    @Override
    public BackendKind kind() {
        return BackendKind.NOOP;
    }

    @Override
    public LogSink create(SinkDsn dsn, PipelineConfig config, MetricsRuntime metrics) {
        // WARN so operators notice that log records go nowhere
        log.warn("NOOP sink active: log records will be discarded");
        return new NoopSink();
    }

    public static final class NoopSink implements LogSink {

        @Override
        public void send(LogRecord record) {
            // discard
        }

        @Override
        public String id() {
            return "noop";
        }
    }
}
