/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.model.ReasonCode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Built-in validation predicates.
 */
public final class Validators {

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern UK_POSTCODE = Pattern.compile("GIR 0AA|[A-Z]{1,2}[0-9][A-Z0-9]? [0-9][A-Z]{2}");
    private static final Pattern PERSON_NAME = Pattern.compile("\\p{L}[\\p{L}\\p{M}' .\\-]*");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final int MAX_NAME_LENGTH = 200;

    private Validators() {}

    public static ValidationRule notBlank() {
        return ValidationRule.of("NOT_BLANK", v -> !v.isBlank(), ReasonCode.INVALID_VALUE);
    }

    /** {@code yyyy-MM-dd} naming a real calendar day. */
    public static ValidationRule isoDate() {
        return ValidationRule.of("ISO_DATE", v -> {
            if (!ISO_DATE.matcher(v).matches()) return false;
            try {
                LocalDate.parse(v);
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }, ReasonCode.MALFORMED_DATE);
    }

    /** Canonical UK form: upper case, single space before the inward code. */
    public static ValidationRule ukPostcode() {
        return ValidationRule.of("UK_POSTCODE", v -> UK_POSTCODE.matcher(v).matches(), ReasonCode.MALFORMED_POSTCODE);
    }

    public static ValidationRule personName() {
        return ValidationRule.of("PERSON_NAME",
                v -> v.length() <= MAX_NAME_LENGTH && PERSON_NAME.matcher(v).matches(),
                ReasonCode.INVALID_NAME);
    }

    public static ValidationRule digits() {
        return ValidationRule.of("DIGITS", v -> DIGITS.matcher(v).matches(), ReasonCode.INVALID_VALUE);
    }

    public static ValidationRule maxLength(int max) {
        if (max <= 0) throw new IllegalArgumentException("max must be > 0");
        return ValidationRule.of("MAX_LENGTH(" + max + ")", v -> !v.isBlank() && v.length() <= max, ReasonCode.INVALID_VALUE);
    }

    public static ValidationRule matches(String regex) {
        final Pattern p = Pattern.compile(regex);
        return ValidationRule.of("MATCHES(" + regex + ")", v -> p.matcher(v).matches(), ReasonCode.INVALID_VALUE);
    }
}
