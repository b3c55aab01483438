/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.metrics;

/**
 * Service Provider Interface (SPI) for Metrics implementations.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.cleankernel.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * The unique identifier matched against {@code metrics.provider} (e.g. "MICROMETER").
     */
    String id();

    /**
     * Creates a runtime instance for this provider if the settings select it.
     *
     * @return a runtime, or {@code null} if the provider should be skipped
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
