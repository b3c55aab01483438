/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRuntimeTest {

    @Test
    void testCountersAndTaggedCounters() {
        try (MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime()) {
            metrics.counter("cleankernel.rows.total");
            metrics.counter("cleankernel.rows.total", 2.0);
            metrics.counter("cleankernel.rows.total", -5.0);
            metrics.counter("cleankernel.rows.rejected", "reason", "MALFORMED_DATE");
            metrics.counter("cleankernel.rows.rejected", "reason", "MALFORMED_DATE");
            metrics.counter("cleankernel.rows.rejected", "reason", "MISSING_REQUIRED_FIELD");

            assertEquals(3.0, metrics.count("cleankernel.rows.total"));
            assertEquals(3.0, metrics.count("cleankernel.rows.rejected"));

            MeterRegistry registry = metrics.registry();
            assertEquals(2.0, registry.get("cleankernel.rows.rejected").tag("reason", "MALFORMED_DATE").counter().count());
            assertEquals(0.0, metrics.count("never.incremented"));
        }
    }

    @Test
    void testGaugeTracksLatestValue() {
        try (MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime()) {
            metrics.gauge("cleankernel.dedup.size", 3);
            metrics.gauge("cleankernel.dedup.size", 5);

            assertEquals(5.0, metrics.registry().get("cleankernel.dedup.size").gauge().value());
        }
    }

    @Test
    void testNoopRuntime() {
        assertFalse(MetricsRuntime.NOOP.enabled());
        assertEquals("NOOP", MetricsRuntime.NOOP.type());
        assertNull(MetricsRuntime.NOOP.registry());
        MetricsRuntime.NOOP.counter("x", "k", "v");
    }
}
