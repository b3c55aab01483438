/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.spi;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.SourceConnector;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.model.RawRow;

/**
 * SPI Definition for row readers (CSV, spreadsheet exports, ...).
 */
public interface SourcePlugin extends PipelinePlugin<SourceConnector<RawRow>> {

    String id(); // e.g. "CSV"

    @Override
    default PluginKind kind() {
        return PluginKind.SOURCE;
    }

    @Override
    SourceConnector<RawRow> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
