/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.extract;

import com.intuitivedesigns.cleankernel.model.FieldType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coerces one raw cell into candidate text. Every kind returns {@link Optional#empty()} for
 * blank cells, null-like markers and values it cannot coerce; none of them throws.
 */
public enum ExtractorKind {

    TEXT {
        @Override
        public Optional<String> extract(Object raw) {
            return asText(raw);
        }
    },

    /** Integral numbers or digit strings: {@code 1001}, {@code 1001.0}, {@code " 1001 "}. */
    IDENTIFIER {
        @Override
        public Optional<String> extract(Object raw) {
            if (raw instanceof Number n) {
                return integral(n).map(String::valueOf);
            }
            return asText(raw)
                    .map(s -> s.endsWith(".0") ? s.substring(0, s.length() - 2) : s)
                    .filter(s -> DIGITS.matcher(s).matches());
        }
    },

    /**
     * Text passes through for the normalizer to parse. Typed dates and spreadsheet serial
     * numbers are converted to ISO text here because only the reader knows they were dates.
     */
    DATE {
        @Override
        public Optional<String> extract(Object raw) {
            if (raw instanceof LocalDate d) return Optional.of(d.toString());
            if (raw instanceof LocalDateTime dt) return Optional.of(dt.toLocalDate().toString());
            if (raw instanceof Number n) {
                final double serial = n.doubleValue();
                if (Double.isNaN(serial) || serial < 1 || serial > MAX_SERIAL) return Optional.empty();
                return Optional.of(SERIAL_EPOCH.plusDays((long) Math.floor(serial)).toString());
            }
            return asText(raw);
        }
    },

    /** First postcode-shaped token anywhere in the cell, as written. */
    POSTCODE {
        @Override
        public Optional<String> extract(Object raw) {
            return asText(raw).flatMap(text -> {
                final Matcher m = POSTCODE_TOKEN.matcher(text);
                return m.find() ? Optional.of(m.group().trim()) : Optional.empty();
            });
        }
    };

    // Spreadsheet day 0; 1900 is treated as a leap year by the format, hence the 30th
    private static final LocalDate SERIAL_EPOCH = LocalDate.of(1899, 12, 30);
    private static final double MAX_SERIAL = 2_958_465d; // 9999-12-31

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern POSTCODE_TOKEN = Pattern.compile(
            "(?i)(?<![A-Z0-9])[A-Z]{1,2}[0-9][A-Z0-9]?\\s*[0-9][A-Z]{2}(?![A-Z0-9])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> NULL_MARKERS = Set.of("null", "nil", "n/a", "#n/a", "-", "--");

    public abstract Optional<String> extract(Object raw);

    public static ExtractorKind defaultFor(FieldType type) {
        return switch (type) {
            case IDENTIFIER -> IDENTIFIER;
            case DATE -> DATE;
            case POSTCODE -> POSTCODE;
            case TEXT -> TEXT;
        };
    }

    public static Optional<ExtractorKind> byName(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static Optional<String> asText(Object raw) {
        if (raw == null) return Optional.empty();

        final String s;
        if (raw instanceof Number n) {
            s = renderNumber(n);
        } else {
            s = WHITESPACE.matcher(String.valueOf(raw)).replaceAll(" ").trim();
        }

        if (s.isEmpty() || NULL_MARKERS.contains(s.toLowerCase(Locale.ROOT))) return Optional.empty();
        return Optional.of(s);
    }

    private static String renderNumber(Number n) {
        final Optional<Long> whole = integral(n);
        if (whole.isPresent()) return String.valueOf(whole.get());
        if (n instanceof BigDecimal bd) return bd.stripTrailingZeros().toPlainString();
        return n.toString();
    }

    private static Optional<Long> integral(Number n) {
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return Optional.of(n.longValue());
        }
        if (n instanceof BigDecimal bd) {
            try {
                return Optional.of(bd.stripTrailingZeros().longValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        final double d = n.doubleValue();
        if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 9.0e15) {
            return Optional.of((long) d);
        }
        return Optional.empty();
    }
}
