/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

/**
 * A pluggable destination for log records.
 *
 * Examples:
 * - Kafka topic
 * - Postgres table
 * - ClickHouse table over HTTP
 * - OpenSearch index
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #send(LogRecord)} should persist or transmit one record.</li>
 * <li>Implementations throw to signal failure. The pipeline retries the whole batch,
 * so the same record may be sent more than once: tolerate duplicates.</li>
 * <li>Implementations apply their own I/O timeouts. A call that never returns
 * stalls delivery for every producer.</li>
 * <li>Each pipeline calls its sink from its own thread only, but one sink may be shared between
 * pipelines and closed from another thread. Implementations that buffer between {@link #send}
 * and {@link #flush} must guard that buffer.</li>
 * </ul>
 */
public interface LogSink extends AutoCloseable {

    /**
     * Persist or send one record to the target system.
     *
     * @param record the normalized record
     * @throws Exception if the target rejects the record or cannot be reached
     */
    void send(LogRecord record) throws Exception;

    /**
     * Forces any client-side buffering out to the target.
     * Called after every fully sent batch; a failure here fails the batch.
     *
     * @throws Exception if the flush fails
     */
    default void flush() throws Exception {
        // no-op by default for non-buffering sinks
    }

    /**
     * Identifier used in logs and metric tags (e.g. "postgres-primary").
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
