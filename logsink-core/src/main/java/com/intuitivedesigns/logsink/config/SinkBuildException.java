/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.config;

/**
 * A sink could not be built: its plugin is not on the class path, or the plugin failed to construct it.
 */
public class SinkBuildException extends RuntimeException {

    private final BackendKind kind;

    public SinkBuildException(BackendKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SinkBuildException(BackendKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public BackendKind kind() {
        return kind;
    }
}
