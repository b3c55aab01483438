/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.metrics;

/**
 * The vendor-agnostic contract for pipeline observability.
 *
 * This interface decouples the pipeline from Micrometer so the core compiles against the
 * contract only and runs with NOOP defaults when no provider is configured.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * A runtime that records nothing.
     */
    MetricsRuntime NOOP = () -> null;

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    /**
     * Counter with a single tag, e.g. rejections by reason code.
     */
    default void counter(String name, String tagKey, String tagValue) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
