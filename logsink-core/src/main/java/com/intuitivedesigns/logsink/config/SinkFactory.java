/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.config;

import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import com.intuitivedesigns.logsink.spi.ServicePluginRegistry;
import com.intuitivedesigns.logsink.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link LogSink} from a DSN by picking the {@link SinkPlugin} registered for its scheme.
 *
 * <p>Backend modules are optional: a DSN whose plugin jar is missing fails here, before any pipeline starts.</p>
 */
public final class SinkFactory {

    private static final Logger log = LoggerFactory.getLogger(SinkFactory.class);

    public static final String KEY_DSN = "logsink.dsn";
    public static final String DEFAULT_DSN = "noop://";

    private static final ServicePluginRegistry<SinkPlugin> PLUGINS =
            new ServicePluginRegistry<>(SinkPlugin.class, resolveClassLoader());

    private SinkFactory() {}

    /**
     * Resolves the DSN from {@code logsink.dsn}, then ENV {@code LOG_SINK_DSN}, then {@code noop://}.
     */
    public static LogSink fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        String dsn = config.getString(KEY_DSN, null);
        if (dsn == null || dsn.isBlank()) {
            dsn = LogSinkEnv.envOr(LogSinkEnv.LOG_SINK_DSN, DEFAULT_DSN);
        }
        return fromDsn(dsn, config, metrics);
    }

    public static LogSink fromDsn(String dsn, PipelineConfig config, MetricsRuntime metrics) {
        return fromDsn(SinkDsn.parse(dsn), config, metrics);
    }

    /**
     * @throws SinkBuildException if no plugin serves the DSN's backend, or the plugin fails
     */
    public static LogSink fromDsn(SinkDsn dsn, PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(dsn, "dsn");
        Objects.requireNonNull(config, "config");
        final MetricsRuntime m = (metrics != null) ? metrics : MetricsRuntime.NOOP;

        final BackendKind kind = dsn.kind();
        final SinkPlugin plugin = PLUGINS.get(kind.name()).orElseThrow(() -> new SinkBuildException(kind,
                "No sink plugin for backend " + kind + " on the class path. Available: " + PLUGINS.availableIds()));

        final LogSink sink;
        try {
            sink = plugin.create(dsn, config, m);
        } catch (Exception e) {
            throw new SinkBuildException(kind, "Failed creating " + kind + " sink for " + dsn + ": " + e.getMessage(), e);
        }
        if (sink == null) {
            throw new SinkBuildException(kind, "Plugin " + plugin.getClass().getName() + " returned no sink");
        }

        log.info("Sink created: backend={} id={} dsn={}", kind, sink.id(), dsn);
        return sink;
    }

    public static Set<String> availableBackends() {
        return PLUGINS.availableIds();
    }

    public static void logAvailablePlugins() {
        log.info("Sink plugins: {}", PLUGINS.availableIds());
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : SinkFactory.class.getClassLoader();
    }
}
