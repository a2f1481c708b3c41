/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import org.slf4j.Logger;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * WARN logging with at most one line per interval; the next line reports how many were suppressed.
 * Arguments are formatted by SLF4J, so pass messages rather than exceptions.
 */
final class RateLimitedLogger {

    private final Logger log;
    private final long intervalMs;
    private final AtomicLong lastLogMs = new AtomicLong(0);
    private final LongAdder suppressed = new LongAdder();

    RateLimitedLogger(Logger log, long intervalMs) {
        this.log = log;
        this.intervalMs = Math.max(1L, intervalMs);
    }

    void warn(String format, Object... args) {
        final long now = System.currentTimeMillis();
        final long last = lastLogMs.get();

        if (now - last >= intervalMs && lastLogMs.compareAndSet(last, now)) {
            final long skipped = suppressed.sumThenReset();
            if (skipped > 0) {
                Object[] withCount = Arrays.copyOf(args, args.length + 1);
                withCount[args.length] = skipped;
                log.warn(format + " (suppressed {} similar)", withCount);
            } else {
                log.warn(format, args);
            }
        } else {
            suppressed.increment();
            if (log.isDebugEnabled()) {
                log.debug(format, args);
            }
        }
    }
}
