/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.extract;

import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.Objects;

/**
 * A tentatively extracted value with its provenance.
 *
 * @param field target field
 * @param value candidate text, {@code null} when absent
 * @param sourceColumn label the value (or the failed attempt) came from; {@code null} if no
 *                     configured column was present in the row
 * @param rawValue the original cell
 */
public record CandidateField(TargetField field, String value, String sourceColumn, Object rawValue) {

    public CandidateField {
        Objects.requireNonNull(field, "field");
    }

    public static CandidateField present(TargetField field, String value, String sourceColumn, Object rawValue) {
        Objects.requireNonNull(value, "value");
        return new CandidateField(field, value, sourceColumn, rawValue);
    }

    public static CandidateField absent(TargetField field) {
        return new CandidateField(field, null, null, null);
    }

    public static CandidateField absent(TargetField field, String sourceColumn, Object rawValue) {
        return new CandidateField(field, null, sourceColumn, rawValue);
    }

    public boolean isPresent() {
        return value != null;
    }
}
