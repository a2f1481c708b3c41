/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: starts at {@code initial}, doubles after every failure, never exceeds {@code max}.
 */
public record BackoffPolicy(Duration initial, Duration max) {

    public BackoffPolicy {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(max, "max");
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial backoff must be > 0");
        }
        if (max.compareTo(initial) < 0) {
            max = initial;
        }
    }

    /** The delay that follows {@code current}. */
    public Duration next(Duration current) {
        if (current.compareTo(max) >= 0) return max;
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(max) > 0 ? max : doubled;
    }
}
