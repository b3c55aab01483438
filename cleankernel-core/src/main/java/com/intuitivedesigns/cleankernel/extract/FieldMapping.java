/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.extract;

import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative {@code target field -> ordered sources} table. Earlier bindings win.
 */
public final class FieldMapping {

    private final Map<TargetField, List<SourceBinding>> bindings;

    private FieldMapping(Map<TargetField, List<SourceBinding>> bindings) {
        this.bindings = bindings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<TargetField> fields() {
        return bindings.keySet();
    }

    public boolean isMapped(TargetField field) {
        return bindings.containsKey(field);
    }

    public List<SourceBinding> bindings(TargetField field) {
        return bindings.getOrDefault(field, List.of());
    }

    @Override
    public String toString() {
        return "FieldMapping" + bindings;
    }

    public static final class Builder {
        private final Map<TargetField, List<SourceBinding>> bindings = new EnumMap<>(TargetField.class);

        private Builder() {}

        public Builder map(TargetField field, String column) {
            Objects.requireNonNull(field, "field");
            return map(field, column, ExtractorKind.defaultFor(field.type()));
        }

        public Builder map(TargetField field, String column, ExtractorKind extractor) {
            Objects.requireNonNull(field, "field");
            bindings.computeIfAbsent(field, f -> new ArrayList<>()).add(new SourceBinding(column, extractor));
            return this;
        }

        public FieldMapping build() {
            final Map<TargetField, List<SourceBinding>> copy = new EnumMap<>(TargetField.class);
            bindings.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return new FieldMapping(Collections.unmodifiableMap(copy));
        }
    }
}
