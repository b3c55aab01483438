/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.metrics;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for the Metrics Runtime.
 */
public final class MetricsSettings {

    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_LOG_SUMMARY = "metrics.log.summary";

    private static final String DEFAULT_PROVIDER = "NOOP";

    public final String providerId;
    public final Map<String, String> commonTags;
    public final boolean logSummaryOnClose;

    private MetricsSettings(String providerId, Map<String, String> commonTags, boolean logSummaryOnClose) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.logSummaryOnClose = logSummaryOnClose;
    }

    public static MetricsSettings from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        final Map<String, String> tags = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : config.withPrefix(KEY_TAG_PREFIX).entrySet()) {
            final String tagKey = entry.getKey().trim();
            final String value = entry.getValue();
            if (tagKey.isEmpty() || value == null || value.isBlank()) continue;
            tags.put(tagKey, value.trim());
        }

        return new MetricsSettings(
                provider == null ? DEFAULT_PROVIDER : provider,
                Collections.unmodifiableMap(tags),
                config.getBoolean(KEY_LOG_SUMMARY, true)
        );
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", logSummaryOnClose=" + logSummaryOnClose +
                '}';
    }

    private static String normalizeUpper(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }
}
