/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

/**
 * Outcome of a non-blocking submission to the pipeline.
 */
public enum OfferResult {
    /** The record is queued and will be delivered while the process lives. */
    ACCEPTED,
    /** The queue was full; the record is dropped and counted. */
    REJECTED;

    public boolean accepted() {
        return this == ACCEPTED;
    }
}
