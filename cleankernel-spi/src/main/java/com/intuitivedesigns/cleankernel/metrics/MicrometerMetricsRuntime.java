/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Composite registry, always backed by an in-memory SimpleMeterRegistry so run totals can be
 *   read back after a batch run
 * - Push-style gauges mapped onto atomic state holders
 */
public class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;

    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this.registry = new CompositeMeterRegistry();
        this.registry.add(new SimpleMeterRegistry());
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void counter(String name, String tagKey, String tagValue) {
        if (tagKey == null || tagValue == null) {
            counter(name);
            return;
        }
        registry.counter(name, tagKey, tagValue).increment();
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        // computeIfAbsent registers the gauge exactly once
        AtomicDouble state = gaugeState.computeIfAbsent(name, key -> {
            AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(key, newState, AtomicDouble::get)
                    .register(registry);
            return newState;
        });
        state.set(value);
    }

    /**
     * Current total of a counter, 0 when it was never incremented.
     */
    public double count(String name) {
        return registry.find(name).counters().stream().mapToDouble(c -> c.count()).sum();
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics Runtime Closed.");
    }

    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
