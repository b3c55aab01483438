/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flat key/value configuration backed by {@link Properties}.
 *
 * <p>{@link #get()} returns the process-wide instance loaded from {@code -Dck.config.path} or
 * ENV {@code CK_CONFIG_PATH}. Tests and embedders build their own with
 * {@link #fromProperties(Properties)} or {@link #load(Path)}.</p>
 */
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String SYS_PROP_PATH = "ck.config.path";
    public static final String ENV_PATH = "CK_CONFIG_PATH";

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
                    local = loadDefault();
                    instance = local;
                }
            }
        }
        return local;
    }

    public static PipelineConfig fromProperties(Properties source) {
        final Properties copy = new Properties();
        if (source != null) {
            for (String name : source.stringPropertyNames()) {
                copy.setProperty(name, source.getProperty(name));
            }
        }
        return new PipelineConfig(copy);
    }

    public static PipelineConfig fromMap(Map<String, String> source) {
        final Properties p = new Properties();
        if (source != null) source.forEach(p::setProperty);
        return new PipelineConfig(p);
    }

    public static PipelineConfig load(Path path) {
        final Properties p = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            p.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties from {}", p.size(), path);
        return new PipelineConfig(p);
    }

    private static PipelineConfig loadDefault() {
        // 1. System property first, 2. environment variable
        String path = System.getProperty(SYS_PROP_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_PATH);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/cleankernel.properties", SYS_PROP_PATH);
            return new PipelineConfig(new Properties());
        }
        return load(Path.of(path.trim()));
    }

    public String getString(String key, String defaultValue) {
        final String v = props.getProperty(key);
        return (v == null) ? defaultValue : v.trim();
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer value for '{}': '{}'", key, val);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for '{}': '{}'", key, val);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Comma separated list; blank entries are dropped. Missing key yields an empty list.
     */
    public List<String> getList(String key) {
        final String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return List.of();
        final List<String> out = new ArrayList<>();
        for (String part : splitTopLevel(raw)) {
            final String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * All entries below {@code prefix}, keyed by the remainder of the key, sorted by key.
     */
    public Map<String, String> withPrefix(String prefix) {
        final Map<String, String> out = new TreeMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                out.put(name.substring(prefix.length()), props.getProperty(name).trim());
            }
        }
        return out;
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

    // Commas inside parentheses belong to a rule argument list: DATE_ORDER(a,b)
    private static List<String> splitTopLevel(String raw) {
        final List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth = Math.max(0, depth - 1);
            else if (c == ',' && depth == 0) {
                parts.add(raw.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(raw.substring(start));
        return parts;
    }
}
