/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class MetricsUtil {

    private MetricsUtil() {}

    /**
     * Applies the configured common tags (e.g. service, env) to every meter of the registry.
     */
    public static void applyCommonTags(MeterRegistry registry, MetricsSettings settings) {
        if (registry == null || settings == null) return;
        registry.config().commonTags(toTags(settings.commonTags));
    }

    /**
     * Converts a raw map into Micrometer {@link Tags}, skipping blank keys or values.
     */
    public static Tags toTags(Map<String, String> input) {
        if (input == null || input.isEmpty()) return Tags.empty();

        final List<Tag> out = new ArrayList<>(input.size());
        for (Map.Entry<String, String> e : input.entrySet()) {
            final String k = safe(e.getKey());
            final String v = safe(e.getValue());
            // Micrometer rejects null keys and values
            if (k != null && v != null) {
                out.add(Tag.of(k, v));
            }
        }
        return out.isEmpty() ? Tags.empty() : Tags.of(out);
    }

    private static String safe(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
