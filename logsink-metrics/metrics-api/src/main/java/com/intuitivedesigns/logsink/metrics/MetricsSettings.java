/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.metrics;

import com.intuitivedesigns.logsink.config.PipelineConfig;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable metrics configuration.
 *
 * <pre>
 * logsink.metrics.provider=PROMETHEUS        # NONE (default), MICROMETER, PROMETHEUS
 * logsink.metrics.tag.service=checkout       # common tags, any number
 * logsink.metrics.prometheus.port=9090
 * logsink.metrics.prometheus.path=/metrics
 * </pre>
 */
public final class MetricsSettings {

    // ---- Config keys ----
    static final String KEY_PROVIDER = "logsink.metrics.provider";
    static final String KEY_TAG_PREFIX = "logsink.metrics.tag.";
    static final String KEY_PROM_PORT = "logsink.metrics.prometheus.port";
    static final String KEY_PROM_PATH = "logsink.metrics.prometheus.path";

    // ---- Defaults ----
    static final String DEFAULT_PROVIDER = "NONE";
    static final int DEFAULT_PROM_PORT = 9090;
    static final String DEFAULT_PROM_PATH = "/metrics";

    public final String providerId;
    public final Map<String, String> commonTags;
    public final int prometheusPort;
    public final String prometheusPath;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort, String prometheusPath) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
        this.prometheusPath = prometheusPath;
    }

    public static MetricsSettings from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        final Map<String, String> tags = new TreeMap<>();
        for (Map.Entry<String, Object> entry : config.asMap().entrySet()) {
            final String k = entry.getKey();
            if (k == null || !k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String value = normalize(String.valueOf(entry.getValue()));
            if (tagKey.isEmpty() || value == null) continue;

            tags.put(tagKey, value);
        }

        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 1, 65_535);

        String path = normalize(config.getString(KEY_PROM_PATH, DEFAULT_PROM_PATH));
        if (path == null) path = DEFAULT_PROM_PATH;
        if (!path.startsWith("/")) path = "/" + path;

        return new MetricsSettings(
                provider == null ? DEFAULT_PROVIDER : provider,
                Collections.unmodifiableMap(tags),
                promPort,
                path
        );
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", prometheusPort=" + prometheusPort +
                ", prometheusPath='" + prometheusPath + '\'' +
                '}';
    }

    // --- Helpers ---

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
