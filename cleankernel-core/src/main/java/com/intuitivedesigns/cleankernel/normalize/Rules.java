/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Built-in transformation rules.
 */
public final class Rules {

    /** Formats tried by {@link #dateIso()} when none are configured. */
    public static final List<String> DEFAULT_DATE_PATTERNS = List.of(
            "yyyy-MM-dd",
            "M/d/yyyy",
            "MMMM d, yyyy",
            "MMM d, yyyy",
            "d MMMM yyyy",
            "d MMM yyyy"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}&&[^'\\-]]");
    private static final Pattern ORDINAL = Pattern.compile("(?i)\\b(\\d{1,2})(st|nd|rd|th)\\b");
    private static final Pattern OF_WORD = Pattern.compile("(?i)\\s+of\\s+");

    private Rules() {}

    public static TransformRule trim() {
        return TransformRule.of("TRIM", String::trim);
    }

    public static TransformRule collapseWhitespace() {
        return TransformRule.of("COLLAPSE_WHITESPACE", v -> WHITESPACE.matcher(v).replaceAll(" "));
    }

    public static TransformRule upperCase() {
        return TransformRule.of("UPPERCASE", v -> v.toUpperCase(Locale.ROOT));
    }

    public static TransformRule lowerCase() {
        return TransformRule.of("LOWERCASE", v -> v.toLowerCase(Locale.ROOT));
    }

    /**
     * First letter of every word upper case, the rest lower case. A word starts after any
     * non-letter, so {@code mary-jane o'neil} becomes {@code Mary-Jane O'Neil}.
     */
    public static TransformRule titleCase() {
        return TransformRule.of("TITLE_CASE", Rules::toTitleCase);
    }

    /** Removes punctuation except hyphens and apostrophes. */
    public static TransformRule stripPunctuation() {
        return TransformRule.of("STRIP_PUNCTUATION", v -> PUNCTUATION.matcher(v).replaceAll(""));
    }

    /**
     * Canonical UK spacing: one space before the three-character inward code.
     * Values of the wrong length are returned unchanged for validation to reject.
     */
    public static TransformRule postcodeSpacing() {
        return TransformRule.of("POSTCODE_SPACING", v -> {
            final String compact = WHITESPACE.matcher(v).replaceAll("");
            if (compact.length() < 5 || compact.length() > 7) return v;
            return compact.substring(0, compact.length() - 3) + " " + compact.substring(compact.length() - 3);
        });
    }

    /**
     * Replaces known recurring mistakes with their correction. Matching is exact on the
     * trimmed value; values not in the table pass through.
     */
    public static TransformRule correct(String tableName, Map<String, String> corrections) {
        final Map<String, String> table = Map.copyOf(corrections);
        return TransformRule.of("CORRECT(" + tableName + ")", v -> table.getOrDefault(v.trim(), v));
    }

    public static TransformRule dateIso() {
        return dateIso(DEFAULT_DATE_PATTERNS);
    }

    /**
     * Parses the value with each pattern in order and emits {@code yyyy-MM-dd}. Ordinal
     * suffixes and a connecting "of" are removed first ({@code 20th of April 2023}).
     * Parsing is strict: {@code 02/30/2023} is not a date. Unparseable values pass through.
     */
    public static TransformRule dateIso(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("At least one date pattern is required");
        }
        final List<DateTimeFormatter> formatters = new ArrayList<>(patterns.size());
        for (String p : patterns) {
            formatters.add(strictFormatter(p));
        }

        return TransformRule.of("DATE_ISO" + patterns, v -> {
            String cleaned = ORDINAL.matcher(v.trim()).replaceAll("$1");
            cleaned = OF_WORD.matcher(cleaned).replaceAll(" ");
            cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
            for (DateTimeFormatter f : formatters) {
                try {
                    return LocalDate.parse(cleaned, f).toString();
                } catch (DateTimeParseException ignored) {
                    // next pattern
                }
            }
            return v;
        });
    }

    static DateTimeFormatter strictFormatter(String pattern) {
        // STRICT resolution needs the proleptic year field 'u' rather than year-of-era 'y'
        final String p = pattern.trim().replace('y', 'u');
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(p)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static String toTitleCase(String v) {
        final StringBuilder sb = new StringBuilder(v.length());
        boolean startOfWord = true;
        for (int i = 0; i < v.length(); i++) {
            final char c = v.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }
}
