/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.metrics;

public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // Only when explicitly selected; the factory falls back to NOOP on its own.
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return MetricsRuntime.NOOP;
    }
}
