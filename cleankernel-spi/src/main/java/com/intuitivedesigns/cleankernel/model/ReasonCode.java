/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stable, enumerable rejection code. Run summaries aggregate by this value, so the name is an
 * API: {@code UPPER_SNAKE_CASE}, never a free-text message.
 */
public record ReasonCode(String name) implements Comparable<ReasonCode> {

    private static final Pattern NAME = Pattern.compile("[A-Z][A-Z0-9_]*");

    public static final ReasonCode MALFORMED_ROW = new ReasonCode("MALFORMED_ROW");
    public static final ReasonCode MISSING_REQUIRED_FIELD = new ReasonCode("MISSING_REQUIRED_FIELD");
    public static final ReasonCode MALFORMED_DATE = new ReasonCode("MALFORMED_DATE");
    public static final ReasonCode MALFORMED_POSTCODE = new ReasonCode("MALFORMED_POSTCODE");
    public static final ReasonCode INVALID_NAME = new ReasonCode("INVALID_NAME");
    public static final ReasonCode INVALID_VALUE = new ReasonCode("INVALID_VALUE");
    public static final ReasonCode CROSS_FIELD_INVALID = new ReasonCode("CROSS_FIELD_INVALID");
    public static final ReasonCode DATE_RANGE_INVERTED = new ReasonCode("DATE_RANGE_INVERTED");
    public static final ReasonCode WRITE_FAILED = new ReasonCode("WRITE_FAILED");
    public static final ReasonCode DESTINATION_REJECTED = new ReasonCode("DESTINATION_REJECTED");
    public static final ReasonCode INTERNAL_ERROR = new ReasonCode("INTERNAL_ERROR");

    public ReasonCode {
        Objects.requireNonNull(name, "name");
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Reason code must be UPPER_SNAKE_CASE: '" + name + "'");
        }
    }

    public static ReasonCode of(String name) {
        return new ReasonCode(name == null ? null : name.trim());
    }

    @Override
    public int compareTo(ReasonCode o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
