/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The committed representation of an accepted row.
 *
 * @param rowId id of the input row that produced it
 * @param identityKey the deduplication key
 * @param values every valid field, in {@link TargetField} order
 * @param configVersion version of the cleansing configuration that produced the values
 */
public record DestinationRecord(
        String rowId,
        String identityKey,
        Map<TargetField, String> values,
        String configVersion
) {

    public DestinationRecord {
        Objects.requireNonNull(rowId, "rowId");
        Objects.requireNonNull(identityKey, "identityKey");
        Objects.requireNonNull(values, "values");
        final EnumMap<TargetField, String> copy = new EnumMap<>(TargetField.class);
        copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
    }

    public String value(TargetField field) {
        return values.get(field);
    }
}
