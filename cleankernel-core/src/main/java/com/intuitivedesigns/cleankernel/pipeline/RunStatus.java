/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.pipeline;

public enum RunStatus {
    /** Every input row has an outcome. */
    COMPLETED,
    /** The run halted on a run-level failure; committed records are kept. */
    ABORTED,
    /** Stopped on request after the row in flight. */
    CANCELLED
}
