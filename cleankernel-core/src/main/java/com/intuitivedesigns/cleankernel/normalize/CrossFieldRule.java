/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.TargetField;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consistency check spanning several fields of one row. Evaluated only when every field it
 * reads is valid; a failure rejects the whole row.
 */
public interface CrossFieldRule {

    String name();

    ReasonCode reason();

    List<TargetField> fields();

    /**
     * @param validValues canonical values of the fields in {@link #fields()}
     * @return true when the row is consistent
     */
    boolean holds(Map<TargetField, String> validValues);

    /**
     * {@code end} must not precede {@code start}. Both values are ISO dates.
     */
    static CrossFieldRule dateOrder(TargetField start, TargetField end, ReasonCode reason) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(reason, "reason");
        final String name = "DATE_ORDER(" + start.wireName() + "," + end.wireName() + ")";
        return new CrossFieldRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ReasonCode reason() {
                return reason;
            }

            @Override
            public List<TargetField> fields() {
                return List.of(start, end);
            }

            @Override
            public boolean holds(Map<TargetField, String> v) {
                try {
                    return !LocalDate.parse(v.get(end)).isBefore(LocalDate.parse(v.get(start)));
                } catch (DateTimeParseException e) {
                    return false;
                }
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
