/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized fields of one row plus the first cross-field violation, if any.
 */
public record NormalizedRow(Map<TargetField, NormalizedField> fields, CrossFieldViolation violation) {

    public NormalizedRow {
        final Map<TargetField, NormalizedField> copy = new EnumMap<>(TargetField.class);
        copy.putAll(fields);
        fields = Collections.unmodifiableMap(copy);
    }

    public NormalizedField get(TargetField field) {
        final NormalizedField f = fields.get(field);
        return (f != null) ? f : NormalizedField.absent(field);
    }

    public Optional<CrossFieldViolation> crossFieldViolation() {
        return Optional.ofNullable(violation);
    }
}
