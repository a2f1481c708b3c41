/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.config;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Backends selectable by DSN scheme. The enum name doubles as the sink plugin id.
 */
public enum BackendKind {
    CLICKHOUSE("clickhouse"),
    POSTGRES("postgres", "postgresql"),
    KAFKA("kafka"),
    OPENSEARCH("opensearch"),
    NOOP("noop"),
    LOG("log");

    private final List<String> schemes;

    BackendKind(String... schemes) {
        this.schemes = List.of(schemes);
    }

    public List<String> schemes() {
        return schemes;
    }

    public static Optional<BackendKind> fromScheme(String scheme) {
        if (scheme == null) return Optional.empty();
        final String s = scheme.trim().toLowerCase(Locale.ROOT);
        for (BackendKind k : values()) {
            if (k.schemes.contains(s)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
