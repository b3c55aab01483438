/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * In-process Micrometer runtime. Batch runs are short, so instead of exporting to a backend the
 * collected totals are logged when the runtime closes.
 */
public final class MicrometerMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsProvider.class);

    public static final String ID = "MICROMETER";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        if (settings == null || !matches(settings.providerId)) {
            return null;
        }

        final MicrometerMetricsRuntime runtime = settings.logSummaryOnClose
                ? new SummaryLoggingRuntime()
                : new MicrometerMetricsRuntime();
        MetricsUtil.applyCommonTags(runtime.registry(), settings);
        return runtime;
    }

    private static final class SummaryLoggingRuntime extends MicrometerMetricsRuntime {
        @Override
        public void close() {
            for (Map.Entry<String, String> e : MetricsUtil.snapshot(registry()).entrySet()) {
                log.info("metric {} = {}", e.getKey(), e.getValue());
            }
            super.close();
        }
    }
}
