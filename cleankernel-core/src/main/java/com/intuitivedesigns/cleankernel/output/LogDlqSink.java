/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.output;

import com.intuitivedesigns.cleankernel.core.DlqSink;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.model.RowOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Logs rejected rows. Suitable for development and small inputs where a dead-letter file is
 * overkill.
 */
public final class LogDlqSink implements DlqSink {

    private static final Logger log = LoggerFactory.getLogger(LogDlqSink.class);

    private final String level;
    private final int maxChars;
    private final boolean logRow;

    public LogDlqSink(String level, int maxChars, boolean logRow) {
        this.level = (level == null || level.isBlank()) ? "WARN" : level.trim().toUpperCase(Locale.ROOT);
        this.maxChars = Math.max(0, maxChars);
        this.logRow = logRow;
    }

    @Override
    public void write(RowOutcome outcome, RawRow row) {
        if (outcome == null || !shouldLog()) return;

        final String content;
        if (logRow) {
            final String raw = String.valueOf(row == null ? null : row.values());
            content = (raw.length() > maxChars) ? raw.substring(0, maxChars) + "... [TRUNCATED]" : raw;
        } else {
            content = "[row logging disabled]";
        }

        final String fmt = "[DLQ] {} rejected: {} ({}) | Row: {}";
        final Object[] args = {outcome.rowId(), outcome.reason(), outcome.detail(), content};
        switch (level) {
            case "ERROR" -> log.error(fmt, args);
            case "INFO" -> log.info(fmt, args);
            case "DEBUG" -> log.debug(fmt, args);
            case "TRACE" -> log.trace(fmt, args);
            default -> log.warn(fmt, args);
        }
    }

    private boolean shouldLog() {
        return switch (level) {
            case "ERROR" -> log.isErrorEnabled();
            case "INFO" -> log.isInfoEnabled();
            case "DEBUG" -> log.isDebugEnabled();
            case "TRACE" -> log.isTraceEnabled();
            case "OFF" -> false;
            default -> log.isWarnEnabled();
        };
    }
}
