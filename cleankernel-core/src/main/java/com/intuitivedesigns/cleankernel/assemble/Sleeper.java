/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.assemble;

import java.time.Duration;

/**
 * Waits between commit attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> {
        if (!d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;
}
