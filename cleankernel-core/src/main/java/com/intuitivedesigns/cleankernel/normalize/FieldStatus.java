/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

public enum FieldStatus {
    VALID,
    INVALID,
    ABSENT
}
