/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

/**
 * Where an event was emitted. Every part is optional.
 */
public record SourceLocation(String modulePath, String file, Integer line) {

    private static final SourceLocation UNKNOWN = new SourceLocation(null, null, null);

    public static SourceLocation unknown() {
        return UNKNOWN;
    }
}
