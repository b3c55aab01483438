/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.plugins;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.output.InMemoryOutputSink;
import com.intuitivedesigns.cleankernel.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * In-memory destination for dry runs. Nothing survives the process.
 * <p>
 * ID: MEMORY
 */
public final class MemorySinkPlugin implements SinkPlugin {

    private static final Logger log = LoggerFactory.getLogger(MemorySinkPlugin.class);

    @Override
    public String id() {
        return InMemoryOutputSink.ID;
    }

    @Override
    public OutputSink create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        // WARN so operators notice that accepted records are not persisted
        log.warn("MEMORY sink active: accepted records are kept in memory only (dry run)");
        return new InMemoryOutputSink(config.getString("sink.memory.id", "memory"));
    }
}
