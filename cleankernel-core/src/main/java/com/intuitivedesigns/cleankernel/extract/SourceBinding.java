/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.extract;

import java.util.Locale;
import java.util.Objects;

/**
 * One candidate source for a target field: a column label and how to coerce its cells.
 */
public record SourceBinding(String column, ExtractorKind extractor) {

    public SourceBinding {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(extractor, "extractor");
        if (column.isBlank()) {
            throw new IllegalArgumentException("Source column must not be blank");
        }
    }

    /**
     * Lenient label form: trimmed, lower case, runs of whitespace collapsed.
     */
    public static String normalizeLabel(String label) {
        if (label == null) return "";
        return label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public String normalizedColumn() {
        return normalizeLabel(column);
    }
}
