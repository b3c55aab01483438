/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.spi;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.DlqSink;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;

/**
 * SPI Definition for dead-letter sinks receiving rejected rows.
 */
public interface DlqSinkPlugin extends PipelinePlugin<DlqSink> {

    String id(); // e.g. "LOG", "JSONL"

    @Override
    default PluginKind kind() {
        return PluginKind.DLQ;
    }

    @Override
    DlqSink create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
