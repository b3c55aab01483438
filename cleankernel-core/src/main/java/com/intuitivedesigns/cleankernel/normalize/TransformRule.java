/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A pure {@code value -> value} correction or canonicalization step.
 * Never validates: a rule that cannot improve its input returns it unchanged.
 */
public interface TransformRule {

    String name();

    String apply(String value);

    static TransformRule of(String name, UnaryOperator<String> fn) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fn, "fn");
        return new TransformRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String apply(String value) {
                return fn.apply(value);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
