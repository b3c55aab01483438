/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of fields the pipeline knows how to extract, normalize and store.
 * Configuration refers to them by {@link #wireName()}.
 */
public enum TargetField {

    EXTERNAL_ID("external_id", FieldType.IDENTIFIER),
    FULL_NAME("full_name", FieldType.TEXT),
    DATE_OF_EVENT("date_of_event", FieldType.DATE),
    END_DATE("end_date", FieldType.DATE),
    POSTCODE("postcode", FieldType.POSTCODE),
    REGION("region", FieldType.TEXT),
    FREE_TEXT_NOTE("free_text_note", FieldType.TEXT);

    private final String wireName;
    private final FieldType type;

    TargetField(String wireName, FieldType type) {
        this.wireName = wireName;
        this.type = type;
    }

    public String wireName() {
        return wireName;
    }

    public FieldType type() {
        return type;
    }

    public static Optional<TargetField> fromWireName(String name) {
        if (name == null) return Optional.empty();
        final String n = name.trim().toLowerCase(Locale.ROOT);
        for (TargetField f : values()) {
            if (f.wireName.equals(n)) return Optional.of(f);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
