/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.spi;

import com.intuitivedesigns.logsink.config.BackendKind;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.config.SinkDsn;
import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;

/**
 * SPI for backend adapters.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.logsink.spi.SinkPlugin}. The plugin id
 * is the {@link BackendKind} name it serves.</p>
 */
public interface SinkPlugin extends ServicePlugin {

    BackendKind kind();

    @Override
    default String id() {
        return kind().name();
    }

    /**
     * Builds a ready-to-use sink. This is the only place a pipeline setup may fail:
     * throw on malformed targets or unreachable mandatory resources.
     *
     * @param dsn     the parsed DSN, already matched to {@link #kind()}
     * @param config  extra tuning (timeouts, table names, client settings)
     * @param metrics metrics runtime, never null
     */
    LogSink create(SinkDsn dsn, PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
