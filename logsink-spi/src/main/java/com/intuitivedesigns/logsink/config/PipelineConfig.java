/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Properties-backed configuration.
 *
 * <p>The process-wide instance ({@link #get()}) loads from {@code -Dlogsink.config.path}
 * or ENV {@code LOGSINK_CONFIG_PATH}. Embedders and tests build their own with {@link #of(Properties)}.</p>
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String PROP_CONFIG_PATH = "logsink.config.path";
    public static final String ENV_CONFIG_PATH = "LOGSINK_CONFIG_PATH";

    private static volatile PipelineConfig instance;

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    public static PipelineConfig get() {
        PipelineConfig local = instance;
        if (local == null) {
            synchronized (PipelineConfig.class) {
                local = instance;
                if (local == null) {
                    local = new PipelineConfig(loadDefault());
                    instance = local;
                }
            }
        }
        return local;
    }

    public static PipelineConfig of(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        copy.putAll(source);
        return new PipelineConfig(copy);
    }

    public static PipelineConfig of(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        copy.putAll(source);
        return new PipelineConfig(copy);
    }

    public static PipelineConfig empty() {
        return new PipelineConfig(new Properties());
    }

    private static Properties loadDefault() {
        Properties loaded = new Properties();

        // 1. System property first, then environment
        String path = System.getProperty(PROP_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        if (path == null || path.isBlank()) {
            log.info("No configuration file specified (-D{} or {}). Using defaults.", PROP_CONFIG_PATH, ENV_CONFIG_PATH);
            return loaded;
        }

        try (InputStream is = Files.newInputStream(Path.of(path))) {
            loaded.load(is);
            log.info("Loaded {} properties from {}", loaded.size(), path);
        } catch (IOException e) {
            // An unreadable file is reported but not fatal: every key has a default
            log.error("Failed to load configuration file {}: {}", path, e.getMessage());
        }
        return loaded;
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer value for {}: '{}'", key, val);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for {}: '{}'", key, val);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
