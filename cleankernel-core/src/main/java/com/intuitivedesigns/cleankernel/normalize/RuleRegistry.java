/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.config.ConfigurationException;
import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves rule names from configuration, such as {@code TRIM}, {@code CORRECT(region)},
 * {@code DATE_ISO(d MMMM yyyy|M/d/yyyy)} or {@code DATE_ORDER(date_of_event,end_date)}, to
 * rule instances. Unknown names and bad arguments fail with {@link ConfigurationException}.
 */
public final class RuleRegistry {

    private static final Set<String> VALIDATIONS =
            Set.of("NOT_BLANK", "ISO_DATE", "UK_POSTCODE", "PERSON_NAME", "DIGITS", "MAX_LENGTH", "MATCHES");

    private final Map<String, Map<String, String>> correctionTables;

    public RuleRegistry() {
        this(Map.of());
    }

    /**
     * @param correctionTables named tables for {@code CORRECT(name)}
     */
    public RuleRegistry(Map<String, Map<String, String>> correctionTables) {
        final Map<String, Map<String, String>> copy = new HashMap<>();
        correctionTables.forEach((k, v) -> copy.put(k.toLowerCase(Locale.ROOT), Map.copyOf(v)));
        this.correctionTables = Collections.unmodifiableMap(copy);
    }

    public boolean isValidation(String expression) {
        return VALIDATIONS.contains(parse(expression).name());
    }

    public TransformRule transform(String expression) {
        final RuleExpr e = parse(expression);
        switch (e.name()) {
            case "TRIM": return noArgs(e, Rules.trim());
            case "COLLAPSE_WHITESPACE": return noArgs(e, Rules.collapseWhitespace());
            case "UPPERCASE": return noArgs(e, Rules.upperCase());
            case "LOWERCASE": return noArgs(e, Rules.lowerCase());
            case "TITLE_CASE": return noArgs(e, Rules.titleCase());
            case "STRIP_PUNCTUATION": return noArgs(e, Rules.stripPunctuation());
            case "POSTCODE_SPACING": return noArgs(e, Rules.postcodeSpacing());
            case "CORRECT": {
                final String table = singleArg(e).toLowerCase(Locale.ROOT);
                final Map<String, String> corrections = correctionTables.get(table);
                if (corrections == null) {
                    throw new ConfigurationException("Unknown correction table '" + table + "' in " + expression);
                }
                return Rules.correct(table, corrections);
            }
            case "DATE_ISO": {
                if (e.args() == null) return Rules.dateIso();
                final List<String> patterns = Arrays.stream(e.args().split("\\|"))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
                try {
                    return Rules.dateIso(patterns);
                } catch (IllegalArgumentException ex) {
                    throw new ConfigurationException("Bad date pattern in " + expression + ": " + ex.getMessage(), ex);
                }
            }
            default:
                if (VALIDATIONS.contains(e.name())) {
                    throw new ConfigurationException("'" + e.name() + "' is a validation, not a transformation");
                }
                throw new ConfigurationException("Unknown transformation rule '" + expression + "'");
        }
    }

    public ValidationRule validation(String expression) {
        final RuleExpr e = parse(expression);
        switch (e.name()) {
            case "NOT_BLANK": return noArgs(e, Validators.notBlank());
            case "ISO_DATE": return noArgs(e, Validators.isoDate());
            case "UK_POSTCODE": return noArgs(e, Validators.ukPostcode());
            case "PERSON_NAME": return noArgs(e, Validators.personName());
            case "DIGITS": return noArgs(e, Validators.digits());
            case "MAX_LENGTH": {
                final String arg = singleArg(e);
                try {
                    return Validators.maxLength(Integer.parseInt(arg));
                } catch (IllegalArgumentException ex) {
                    throw new ConfigurationException("Bad length in " + expression, ex);
                }
            }
            case "MATCHES": {
                try {
                    return Validators.matches(singleArg(e));
                } catch (IllegalArgumentException ex) {
                    throw new ConfigurationException("Bad regex in " + expression + ": " + ex.getMessage(), ex);
                }
            }
            default:
                throw new ConfigurationException("Unknown validation rule '" + expression + "'");
        }
    }

    /**
     * {@code DATE_ORDER(start,end)} or {@code DATE_ORDER(start,end,REASON)}; the reason defaults
     * to {@link ReasonCode#DATE_RANGE_INVERTED}.
     */
    public CrossFieldRule crossField(String expression) {
        final RuleExpr e = parse(expression);
        if (!"DATE_ORDER".equals(e.name())) {
            throw new ConfigurationException("Unknown cross-field rule '" + expression + "'");
        }
        if (e.args() == null) {
            throw new ConfigurationException(expression + " needs (start,end) arguments");
        }
        final String[] parts = e.args().split(",");
        if (parts.length < 2 || parts.length > 3) {
            throw new ConfigurationException(expression + " needs (start,end[,REASON]) arguments");
        }
        final TargetField start = field(parts[0], expression);
        final TargetField end = field(parts[1], expression);
        if (start == end) {
            throw new ConfigurationException(expression + " compares a field with itself");
        }
        final ReasonCode reason;
        try {
            reason = parts.length == 3 ? ReasonCode.of(parts[2].trim()) : ReasonCode.DATE_RANGE_INVERTED;
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Bad reason code in " + expression, ex);
        }
        return CrossFieldRule.dateOrder(start, end, reason);
    }

    private static TargetField field(String wireName, String expression) {
        return TargetField.fromWireName(wireName.trim())
                .orElseThrow(() -> new ConfigurationException("Unknown field '" + wireName.trim() + "' in " + expression));
    }

    private static <R> R noArgs(RuleExpr e, R rule) {
        if (e.args() != null) {
            throw new ConfigurationException("Rule " + e.name() + " takes no arguments");
        }
        return rule;
    }

    private static String singleArg(RuleExpr e) {
        if (e.args() == null || e.args().isBlank()) {
            throw new ConfigurationException("Rule " + e.name() + " needs an argument");
        }
        return e.args().trim();
    }

    static RuleExpr parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Empty rule name");
        }
        final String s = expression.trim();
        final int open = s.indexOf('(');
        if (open < 0) {
            return new RuleExpr(s.toUpperCase(Locale.ROOT), null);
        }
        if (!s.endsWith(")")) {
            throw new ConfigurationException("Unbalanced parentheses in rule '" + s + "'");
        }
        return new RuleExpr(s.substring(0, open).trim().toUpperCase(Locale.ROOT), s.substring(open + 1, s.length() - 1));
    }

    record RuleExpr(String name, String args) {}
}
