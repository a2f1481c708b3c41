/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.plugins;

import com.intuitivedesigns.logsink.config.BackendKind;
import com.intuitivedesigns.logsink.config.PipelineConfig;
import com.intuitivedesigns.logsink.config.SinkDsn;
import com.intuitivedesigns.logsink.core.LogRecord;
import com.intuitivedesigns.logsink.core.LogRecordJson;
import com.intuitivedesigns.logsink.core.LogSink;
import com.intuitivedesigns.logsink.core.PipelineSettings;
import com.intuitivedesigns.logsink.metrics.MetricsRuntime;
import com.intuitivedesigns.logsink.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Backend ({@code log://}) that writes each record as JSON to the local SLF4J logger {@code logsink.echo}.
 * Useful for development, or where a real backend is overkill.
 *
 * <p>The level comes from {@code log://?level=WARN} or {@code logsink.log.level} (default INFO).</p>
 */
public final class LogSinkPlugin implements SinkPlugin {

    private static final Logger log = LoggerFactory.getLogger(LogSinkPlugin.class);

    public static final String ECHO_LOGGER = PipelineSettings.ECHO_LOGGER;

    // Config keys
    static final String CFG_LEVEL = "logsink.log.level";
    static final String CFG_MAX_CHARS = "logsink.log.max.chars";

    // Defaults
    private static final String DEFAULT_LEVEL = "INFO";
    private static final int DEFAULT_MAX_CHARS = 1024;

    @Override
    public BackendKind kind() {
        return BackendKind.LOG;
    }

    @Override
    public LogSink create(SinkDsn dsn, PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(dsn, "dsn");
        Objects.requireNonNull(config, "config");

        final String level = normalizeUpper(dsn.param("level", config.getString(CFG_LEVEL, DEFAULT_LEVEL)));
        final int maxChars = clampInt(config.getInt(CFG_MAX_CHARS, DEFAULT_MAX_CHARS), 16, 1_048_576);

        log.info("Initialized LOG sink (logger={}, level={}, maxChars={})", ECHO_LOGGER, level, maxChars);
        return new EchoSink(LoggerFactory.getLogger(ECHO_LOGGER), level, maxChars);
    }

    static final class EchoSink implements LogSink {

        private final Logger out;
        private final String level;
        private final int maxChars;

        EchoSink(Logger out, String level, int maxChars) {
            this.out = out;
            this.level = level;
            this.maxChars = maxChars;
        }

        @Override
        public void send(LogRecord record) {
            if (!enabled()) return;
            final String json = LogRecordJson.toJson(record);
            final String content = (json.length() > maxChars)
                    ? json.substring(0, maxChars) + "... [TRUNCATED]"
                    : json;
            write(content);
        }

        @Override
        public String id() {
            return "log";
        }

        private boolean enabled() {
            return switch (level) {
                case "ERROR" -> out.isErrorEnabled();
                case "WARN" -> out.isWarnEnabled();
                case "DEBUG" -> out.isDebugEnabled();
                case "TRACE" -> out.isTraceEnabled();
                case "OFF" -> false;
                default -> out.isInfoEnabled();
            };
        }

        private void write(String content) {
            switch (level) {
                case "ERROR" -> out.error(content);
                case "WARN" -> out.warn(content);
                case "DEBUG" -> out.debug(content);
                case "TRACE" -> out.trace(content);
                case "OFF" -> { }
                default -> out.info(content);
            }
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static String normalizeUpper(String s) {
        if (s == null || s.isBlank()) return DEFAULT_LEVEL;
        return s.trim().toUpperCase(Locale.ROOT);
    }
}
