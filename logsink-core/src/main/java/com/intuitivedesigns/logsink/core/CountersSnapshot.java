/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

/**
 * Point-in-time copy of the pipeline counters.
 *
 * <p>Values are read one after another, not atomically; under load {@code enqueued + dropped}
 * may trail {@code observed} by the offers in progress.</p>
 *
 * @param observed         records submitted to the handle
 * @param enqueued         records accepted into the queue
 * @param dropped          records rejected because the queue was full
 * @param dequeued         records taken by the pipeline thread
 * @param delivered        records in batches the sink fully accepted
 * @param batchesDelivered batches the sink fully accepted
 * @param retries          failed delivery attempts (each one followed by a backoff)
 */
public record CountersSnapshot(
        long observed,
        long enqueued,
        long dropped,
        long dequeued,
        long delivered,
        long batchesDelivered,
        long retries
) {
}
