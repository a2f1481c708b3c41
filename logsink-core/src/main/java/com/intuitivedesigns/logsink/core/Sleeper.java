/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pause used between delivery attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> TimeUnit.NANOSECONDS.sleep(d.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
