/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.config;

import com.intuitivedesigns.cleankernel.core.DlqSink;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.core.SourceConnector;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.spi.DlqSinkPlugin;
import com.intuitivedesigns.cleankernel.spi.PipelinePlugin;
import com.intuitivedesigns.cleankernel.spi.PluginCatalog;
import com.intuitivedesigns.cleankernel.spi.SinkPlugin;
import com.intuitivedesigns.cleankernel.spi.SourcePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates the pluggable components of a run from {@code source.type}, {@code sink.type} and
 * {@code dlq.type}.
 */
public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    // Config keys
    public static final String KEY_SOURCE_TYPE = "source.type";
    public static final String KEY_SINK_TYPE = "sink.type";
    public static final String KEY_DLQ_TYPE = "dlq.type";

    // Defaults
    private static final String DEFAULT_SINK = "MEMORY";
    private static final String DEFAULT_DLQ = "LOG";

    private static final PluginCatalog CATALOG = new PluginCatalog(resolveClassLoader());

    private PipelineFactory() {}

    public static SourceConnector<RawRow> createSource(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = require(config, KEY_SOURCE_TYPE);
        final SourcePlugin plugin = CATALOG.sources().require(id, KEY_SOURCE_TYPE);
        return createSafe(plugin, config, metrics, "Source");
    }

    public static OutputSink createSink(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_SINK_TYPE, DEFAULT_SINK), DEFAULT_SINK);
        final SinkPlugin plugin = CATALOG.sinks().require(id, KEY_SINK_TYPE);
        return createSafe(plugin, config, metrics, "Sink");
    }

    public static DlqSink createDlq(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_DLQ_TYPE, DEFAULT_DLQ), DEFAULT_DLQ);
        final DlqSinkPlugin plugin = CATALOG.dlqSinks().require(id, KEY_DLQ_TYPE);
        return createSafe(plugin, config, metrics, "DLQ");
    }

    public static void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Sources:   {}", CATALOG.sources().availableIds());
        log.info("  Sinks:     {}", CATALOG.sinks().availableIds());
        log.info("  DLQ Sinks: {}", CATALOG.dlqSinks().availableIds());
    }

    private static String require(PipelineConfig config, String key) {
        final String v = config.getString(key, null);
        if (v == null) {
            throw new IllegalArgumentException("Missing required configuration key: " + key);
        }
        if (v.isEmpty()) {
            throw new IllegalArgumentException("Blank value for required configuration key: " + key);
        }
        return v;
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineFactory.class.getClassLoader();
    }

    static <T> T createSafe(PipelinePlugin<T> plugin,
                            PipelineConfig config,
                            MetricsRuntime metrics,
                            String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(config, metrics);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}
