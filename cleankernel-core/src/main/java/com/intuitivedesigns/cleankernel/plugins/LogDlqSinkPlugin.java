/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.plugins;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.DlqSink;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.output.LogDlqSink;
import com.intuitivedesigns.cleankernel.spi.DlqSinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Dead letters to the application log.
 * <p>
 * ID: LOG
 */
public final class LogDlqSinkPlugin implements DlqSinkPlugin {

    private static final Logger log = LoggerFactory.getLogger(LogDlqSinkPlugin.class);

    // Config keys
    private static final String CFG_MAX_LOG_CHARS = "dlq.log.max.chars";
    private static final String CFG_LOG_LEVEL = "dlq.log.level";
    private static final String CFG_LOG_ROW = "dlq.log.row.enabled";

    @Override
    public String id() {
        return "LOG";
    }

    @Override
    public DlqSink create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final int maxChars = Math.max(0, Math.min(1_048_576, config.getInt(CFG_MAX_LOG_CHARS, 1024)));
        final String level = config.getString(CFG_LOG_LEVEL, "WARN");
        final boolean logRow = config.getBoolean(CFG_LOG_ROW, true);

        log.info("Initialized log DLQ (Level={}, MaxChars={})", level, maxChars);
        return new LogDlqSink(level, maxChars, logRow);
    }
}
