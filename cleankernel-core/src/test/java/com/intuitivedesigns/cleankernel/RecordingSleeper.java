/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel;

import com.intuitivedesigns.cleankernel.assemble.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Records requested waits instead of sleeping. */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> waits = new ArrayList<>();

    @Override
    public synchronized void sleep(Duration duration) {
        waits.add(duration);
    }

    public synchronized List<Duration> waits() {
        return List.copyOf(waits);
    }
}
