/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.plugins;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.output.JdbcOutputSink;
import com.intuitivedesigns.cleankernel.spi.SinkPlugin;

/**
 * ID: JDBC
 */
public final class JdbcSinkPlugin implements SinkPlugin {

    @Override
    public String id() {
        return "JDBC";
    }

    @Override
    public OutputSink create(PipelineConfig config, MetricsRuntime metrics) {
        return JdbcOutputSink.fromConfig(config, metrics);
    }
}
