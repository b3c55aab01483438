/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.assemble;

import com.intuitivedesigns.cleankernel.model.FieldType;
import com.intuitivedesigns.cleankernel.model.TargetField;
import com.intuitivedesigns.cleankernel.normalize.NormalizedField;
import com.intuitivedesigns.cleankernel.normalize.NormalizedRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Deduplication key: the canonical values of the identity fields, in configured order.
 * Components are upper cased with internal whitespace collapsed; postcode components drop all
 * whitespace, so {@code ("Jane Doe", "SW1A 1AA")} becomes {@code ("JANE DOE", "SW1A1AA")}.
 */
public record IdentityKey(List<String> components) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String SEPARATOR = "|";

    public IdentityKey {
        components = List.copyOf(components);
        if (components.isEmpty()) throw new IllegalArgumentException("Identity key needs at least one component");
    }

    public static IdentityKey of(String... components) {
        return new IdentityKey(List.of(components));
    }

    /**
     * @return the key, or empty when any identity field is not valid
     */
    public static Optional<IdentityKey> derive(List<TargetField> identityFields, NormalizedRow row) {
        final List<String> parts = new ArrayList<>(identityFields.size());
        for (TargetField field : identityFields) {
            final NormalizedField nf = row.get(field);
            if (!nf.isValid()) return Optional.empty();
            parts.add(canonical(field, nf.value()));
        }
        return Optional.of(new IdentityKey(parts));
    }

    static String canonical(TargetField field, String value) {
        final String upper = value.trim().toUpperCase(Locale.ROOT);
        return field.type() == FieldType.POSTCODE
                ? WHITESPACE.matcher(upper).replaceAll("")
                : WHITESPACE.matcher(upper).replaceAll(" ");
    }

    /**
     * Stable string form used as the destination's unique key. Backslash and the separator are
     * escaped inside components, so distinct component lists never share a key.
     */
    public String value() {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(escape(components.get(i)));
        }
        return sb.toString();
    }

    private static String escape(String component) {
        return component.replace("\\", "\\\\").replace(SEPARATOR, "\\" + SEPARATOR);
    }

    @Override
    public String toString() {
        return value();
    }
}
