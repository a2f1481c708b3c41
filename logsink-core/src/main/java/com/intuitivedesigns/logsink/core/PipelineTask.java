/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import java.time.Duration;
import java.util.Objects;

/**
 * The pipeline's background thread. There is no stop: the thread is a daemon and ends with the JVM.
 */
public final class PipelineTask {

    private final Thread thread;

    PipelineTask(Thread thread) {
        this.thread = Objects.requireNonNull(thread, "thread");
    }

    public String name() {
        return thread.getName();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    /** True when called from the pipeline thread itself (e.g. from inside a sink). */
    public boolean isCurrentThread() {
        return Thread.currentThread() == thread;
    }

    /**
     * Waits up to {@code timeout} for the thread to end.
     *
     * @return true if the thread has ended
     */
    public boolean join(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        thread.join(Math.max(1L, timeout.toMillis()));
        return !thread.isAlive();
    }

    void interrupt() {
        thread.interrupt();
    }

    @Override
    public String toString() {
        return "PipelineTask{" + name() + ", alive=" + isAlive() + '}';
    }
}
