/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.Objects;

/**
 * Outcome of the rule chain for one field.
 *
 * @param field target field
 * @param value canonical value when valid; last transformed value when invalid; {@code null} when absent
 * @param status valid, invalid or absent
 * @param reason why an invalid field failed; {@code null} otherwise
 * @param original the candidate text before any rule ran
 */
public record NormalizedField(TargetField field, String value, FieldStatus status, ReasonCode reason, String original) {

    public NormalizedField {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(status, "status");
        if (status == FieldStatus.INVALID && reason == null) {
            throw new IllegalArgumentException("Invalid field " + field + " needs a reason code");
        }
    }

    public static NormalizedField valid(TargetField field, String value, String original) {
        return new NormalizedField(field, Objects.requireNonNull(value, "value"), FieldStatus.VALID, null, original);
    }

    public static NormalizedField invalid(TargetField field, String value, ReasonCode reason, String original) {
        return new NormalizedField(field, value, FieldStatus.INVALID, reason, original);
    }

    public static NormalizedField absent(TargetField field) {
        return new NormalizedField(field, null, FieldStatus.ABSENT, null, null);
    }

    public boolean isValid() {
        return status == FieldStatus.VALID;
    }
}
