/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The normalized unit of data flowing through the pipeline: one observed log event.
 *
 * Design Principles:
 * - Immutability: a record is built once at the ingestion boundary and never changes.
 * - Provenance: the timestamp is the observation time, not the send time.
 * - Separation: the human-readable message lives in its own slot, never inside {@link #fields()}.
 *
 * @param timestamp   UTC instant at which the event was observed.
 * @param level       Severity (e.g. "ERROR").
 * @param target      Origin identifier, usually the logger name.
 * @param modulePath  Optional logical module (package / class), may be null.
 * @param file        Optional source file, may be null.
 * @param line        Optional source line, may be null.
 * @param message     Optional formatted message, may be null.
 * @param fields      Caller-supplied structured context, sorted by key.
 * @param serviceName Optional logical service name for shared tables/topics, may be null.
 */
public record LogRecord(
        Instant timestamp,
        String level,
        String target,
        String modulePath,
        String file,
        Integer line,
        String message,
        Map<String, FieldValue> fields,
        String serviceName
) {

    /** Field name reserved for the message slot. */
    public static final String MESSAGE_KEY = "message";

    public LogRecord {
        Objects.requireNonNull(timestamp, "LogRecord timestamp cannot be null");
        Objects.requireNonNull(level, "LogRecord level cannot be null");
        Objects.requireNonNull(target, "LogRecord target cannot be null");

        if (fields == null || fields.isEmpty()) {
            fields = Collections.emptySortedMap();
        } else {
            if (fields.containsKey(MESSAGE_KEY)) {
                throw new IllegalArgumentException("'" + MESSAGE_KEY + "' is reserved for the message slot");
            }
            TreeMap<String, FieldValue> sorted = new TreeMap<>();
            for (Map.Entry<String, FieldValue> e : fields.entrySet()) {
                sorted.put(Objects.requireNonNull(e.getKey(), "field name"),
                        Objects.requireNonNull(e.getValue(), "field value"));
            }
            fields = Collections.unmodifiableSortedMap(sorted);
        }
    }

    public static Builder builder(String level, String target) {
        return new Builder(level, target);
    }

    public LogRecord withServiceName(String newServiceName) {
        return new LogRecord(timestamp, level, target, modulePath, file, line, message, fields, newServiceName);
    }

    public static final class Builder {
        private Instant timestamp;
        private final String level;
        private final String target;
        private String modulePath;
        private String file;
        private Integer line;
        private String message;
        private final Map<String, FieldValue> fields = new TreeMap<>();
        private String serviceName;

        private Builder(String level, String target) {
            this.level = level;
            this.target = target;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder modulePath(String modulePath) {
            this.modulePath = modulePath;
            return this;
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder line(Integer line) {
            this.line = line;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder field(String name, FieldValue value) {
            fields.put(name, value);
            return this;
        }

        public Builder field(String name, Object value) {
            return field(name, FieldValue.of(value));
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public LogRecord build() {
            Instant ts = (timestamp != null) ? timestamp : Instant.now();
            return new LogRecord(ts, level, target, modulePath, file, line, message, fields, serviceName);
        }
    }
}
