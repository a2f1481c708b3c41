/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.config;

/**
 * A DSN that cannot be parsed or names an unknown backend scheme.
 */
public class DsnException extends IllegalArgumentException {

    public DsnException(String message) {
        super(message);
    }
}
