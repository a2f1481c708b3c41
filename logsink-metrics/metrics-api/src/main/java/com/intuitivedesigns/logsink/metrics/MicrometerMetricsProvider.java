/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

/**
 * In-process Micrometer registry, for embedders that read meters themselves or add their own registries.
 */
public final class MicrometerMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "MICROMETER";
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        if (settings == null || !matches(settings.providerId)) {
            return null;
        }
        MicrometerMetricsRuntime rt = new MicrometerMetricsRuntime();
        MetricsUtil.applyCommonTags(rt.registry(), settings);
        return rt;
    }
}
