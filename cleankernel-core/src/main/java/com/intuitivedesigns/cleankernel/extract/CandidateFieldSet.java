/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.extract;

import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Candidate values for every mapped target field of one row. Fields that could not be
 * extracted are present as explicit absent entries.
 */
public final class CandidateFieldSet {

    private final Map<TargetField, CandidateField> fields;

    CandidateFieldSet(Map<TargetField, CandidateField> fields) {
        final Map<TargetField, CandidateField> copy = new EnumMap<>(TargetField.class);
        copy.putAll(fields);
        this.fields = Collections.unmodifiableMap(copy);
    }

    public static CandidateFieldSet of(Collection<CandidateField> candidates) {
        final Map<TargetField, CandidateField> m = new EnumMap<>(TargetField.class);
        for (CandidateField c : candidates) m.put(c.field(), c);
        return new CandidateFieldSet(m);
    }

    public CandidateField get(TargetField field) {
        final CandidateField c = fields.get(field);
        return (c != null) ? c : CandidateField.absent(field);
    }

    public Collection<CandidateField> all() {
        return fields.values();
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CandidateFieldSet other && fields.equals(other.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "CandidateFieldSet" + fields.values();
    }
}
