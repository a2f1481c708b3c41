/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a host logging event (level, target, key/value pairs, call site) into a {@link LogRecord}.
 *
 * <p>The key {@code message} goes to the record's message slot; every other value is converted
 * with {@link FieldValue#of(Object)}. Events below the minimum severity are not accepted.</p>
 */
public final class RecordTranslator {

    public enum Severity {
        TRACE, DEBUG, INFO, WARN, ERROR;

        /**
         * Case-insensitive; accepts {@code WARNING}, and maps {@code FATAL}/{@code CRITICAL} to ERROR.
         */
        public static Optional<Severity> parse(String level) {
            if (level == null || level.isBlank()) return Optional.empty();
            String s = level.trim().toUpperCase(Locale.ROOT);
            switch (s) {
                case "WARNING":
                    return Optional.of(WARN);
                case "FATAL":
                case "CRITICAL":
                    return Optional.of(ERROR);
                default:
                    try {
                        return Optional.of(Severity.valueOf(s));
                    } catch (IllegalArgumentException e) {
                        return Optional.empty();
                    }
            }
        }
    }

    private final Severity minimumLevel;
    private final String defaultServiceName;
    private final Clock clock;

    private RecordTranslator(Builder b) {
        this.minimumLevel = b.minimumLevel;
        this.defaultServiceName = blankToNull(b.serviceName);
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Severity minimumLevel() {
        return minimumLevel;
    }

    /** Unknown levels are never accepted. */
    public boolean accepts(String level) {
        return Severity.parse(level).map(s -> s.compareTo(minimumLevel) >= 0).orElse(false);
    }

    public LogRecord translate(String level, String target, Map<String, ?> values, SourceLocation location) {
        return translate(level, target, values, location, Instant.now(clock));
    }

    /**
     * Same as {@link #translate(String, String, Map, SourceLocation)} for hosts that stamp their own events.
     */
    public LogRecord translate(String level, String target, Map<String, ?> values, SourceLocation location, Instant timestamp) {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(timestamp, "timestamp");
        final SourceLocation loc = (location != null) ? location : SourceLocation.unknown();

        final LogRecord.Builder b = LogRecord.builder(normalizeLevel(level), target)
                .timestamp(timestamp)
                .modulePath(loc.modulePath())
                .file(loc.file())
                .line(loc.line())
                .serviceName(defaultServiceName);

        if (values != null) {
            for (Map.Entry<String, ?> e : values.entrySet()) {
                final String key = e.getKey();
                if (key == null) continue;
                if (LogRecord.MESSAGE_KEY.equals(key)) {
                    b.message(e.getValue() == null ? null : String.valueOf(e.getValue()));
                } else {
                    b.field(key, FieldValue.of(e.getValue()));
                }
            }
        }
        return b.build();
    }

    private static String normalizeLevel(String level) {
        return Severity.parse(level).map(Enum::name).orElse(level.trim().toUpperCase(Locale.ROOT));
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    public static final class Builder {
        private Severity minimumLevel = Severity.ERROR;
        private String serviceName;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder minimumLevel(Severity minimumLevel) {
            this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public RecordTranslator build() {
            return new RecordTranslator(this);
        }
    }
}
