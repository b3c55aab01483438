/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

public final class MetricsUtil {

    private MetricsUtil() {}

    /**
     * Apply common tags from settings to a Micrometer registry.
     */
    public static void applyCommonTags(MeterRegistry registry, MetricsSettings settings) {
        if (registry == null || settings == null) return;
        registry.config().commonTags(toTags(settings.commonTags));
    }

    /**
     * Convert a raw Map into Micrometer {@link Tags}, skipping null or blank entries.
     */
    public static Tags toTags(Map<String, String> input) {
        if (input == null || input.isEmpty()) return Tags.empty();

        final List<Tag> out = new ArrayList<>(input.size());
        for (Map.Entry<String, String> e : input.entrySet()) {
            final String k = safe(e.getKey());
            final String v = safe(e.getValue());
            if (k != null && v != null) {
                out.add(Tag.of(k, v));
            }
        }
        return out.isEmpty() ? Tags.empty() : Tags.of(out);
    }

    /**
     * One line per counter and timer, sorted by meter id, for an end-of-run log.
     */
    public static Map<String, String> snapshot(MeterRegistry registry) {
        final Map<String, String> out = new TreeMap<>();
        if (registry == null) return out;
        for (Meter meter : registry.getMeters()) {
            final String key = describe(meter.getId());
            if (meter instanceof Counter c) {
                out.put(key, String.format("%.0f", c.count()));
            } else if (meter instanceof Timer t) {
                out.put(key, String.format("count=%d total=%.1fms", t.count(), t.totalTime(TimeUnit.MILLISECONDS)));
            }
        }
        return out;
    }

    private static String describe(Meter.Id id) {
        final StringBuilder sb = new StringBuilder(id.getName());
        for (Tag tag : id.getTagsAsIterable()) {
            sb.append('[').append(tag.getKey()).append('=').append(tag.getValue()).append(']');
        }
        return sb.toString();
    }

    private static String safe(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
