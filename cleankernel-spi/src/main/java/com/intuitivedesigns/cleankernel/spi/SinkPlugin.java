/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.spi;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;

/**
 * SPI Definition for destination stores.
 */
public interface SinkPlugin extends PipelinePlugin<OutputSink> {

    String id(); // e.g. "JDBC", "MEMORY"

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    OutputSink create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
