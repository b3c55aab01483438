/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.plugins;

import com.intuitivedesigns.cleankernel.config.ConfigurationException;
import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.DlqSink;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.output.JsonlDlqSink;
import com.intuitivedesigns.cleankernel.spi.DlqSinkPlugin;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Dead letters as JSON lines.
 * <p>
 * ID: JSONL
 */
public final class JsonlDlqSinkPlugin implements DlqSinkPlugin {

    private static final String CFG_PATH = "dlq.jsonl.path";
    private static final String CFG_APPEND = "dlq.jsonl.append";

    @Override
    public String id() {
        return "JSONL";
    }

    @Override
    public DlqSink create(PipelineConfig config, MetricsRuntime metrics) throws IOException {
        Objects.requireNonNull(config, "config");
        final String path = config.getString(CFG_PATH, null);
        if (path == null || path.isEmpty()) {
            throw new ConfigurationException("Missing required configuration key: " + CFG_PATH);
        }
        return new JsonlDlqSink(Path.of(path), config.getBoolean(CFG_APPEND, false));
    }
}
