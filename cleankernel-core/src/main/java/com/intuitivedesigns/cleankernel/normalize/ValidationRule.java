/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.model.ReasonCode;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Terminal pass/fail predicate of a field's rule chain.
 */
public interface ValidationRule {

    String name();

    ReasonCode reason();

    boolean test(String value);

    default ValidationRule withReason(ReasonCode reason) {
        return of(name(), this::test, reason);
    }

    static ValidationRule of(String name, Predicate<String> predicate, ReasonCode reason) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(reason, "reason");
        return new ValidationRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public ReasonCode reason() {
                return reason;
            }

            @Override
            public boolean test(String value) {
                return value != null && predicate.test(value);
            }

            @Override
            public String toString() {
                return name + "->" + reason;
            }
        };
    }
}
