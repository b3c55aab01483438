/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One unprocessed input record: an ordered column-label to scalar mapping.
 *
 * <p>Values are whatever the reader produced ({@code String}, {@code Number}, {@code LocalDate},
 * blank or {@code null}). A reader that could not turn a record into a mapping at all returns
 * a {@link #malformed(long, String) malformed} row instead of failing the whole stream.</p>
 */
public final class RawRow {

    private final long rowNumber;
    private final Map<String, Object> values;
    private final String structuralError;

    private RawRow(long rowNumber, Map<String, Object> values, String structuralError) {
        this.rowNumber = rowNumber;
        this.values = values;
        this.structuralError = structuralError;
    }

    public static RawRow of(long rowNumber, Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        // LinkedHashMap: keeps column order and tolerates null cells
        return new RawRow(rowNumber, Collections.unmodifiableMap(new LinkedHashMap<>(values)), null);
    }

    public static RawRow malformed(long rowNumber, String structuralError) {
        final String err = (structuralError == null || structuralError.isBlank()) ? "unreadable row" : structuralError;
        return new RawRow(rowNumber, Map.of(), err);
    }

    public long rowNumber() {
        return rowNumber;
    }

    public String rowId() {
        return "row-" + rowNumber;
    }

    public Map<String, Object> values() {
        return values;
    }

    public boolean isMalformed() {
        return structuralError != null;
    }

    public Optional<String> structuralError() {
        return Optional.ofNullable(structuralError);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawRow other)) return false;
        return rowNumber == other.rowNumber
                && values.equals(other.values)
                && Objects.equals(structuralError, other.structuralError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, values, structuralError);
    }

    @Override
    public String toString() {
        return isMalformed()
                ? "RawRow{#" + rowNumber + " malformed='" + structuralError + "'}"
                : "RawRow{#" + rowNumber + " " + values + "}";
    }
}
