/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.List;

public record CrossFieldViolation(String rule, ReasonCode reason, List<TargetField> fields, String detail) {

    public CrossFieldViolation {
        fields = List.copyOf(fields);
    }
}
