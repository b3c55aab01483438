/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.extract.CandidateField;
import com.intuitivedesigns.cleankernel.extract.CandidateFieldSet;
import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs each field's rule chain, then the cross-field rules.
 *
 * <p>Holds no per-row state, so one instance may serve several threads.</p>
 */
public final class NormalizationEngine {

    private final RuleTable rules;

    public NormalizationEngine(RuleTable rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public NormalizedRow normalize(CandidateFieldSet candidates) {
        Objects.requireNonNull(candidates, "candidates");

        final Map<TargetField, NormalizedField> out = new EnumMap<>(TargetField.class);
        for (CandidateField candidate : candidates.all()) {
            out.put(candidate.field(), normalizeField(candidate));
        }

        return new NormalizedRow(out, firstViolation(out));
    }

    private NormalizedField normalizeField(CandidateField candidate) {
        final Optional<FieldRuleChain> chain = rules.chain(candidate.field());
        if (chain.isPresent()) {
            return chain.get().apply(candidate);
        }
        // No rules configured: any extracted value is acceptable as is
        return candidate.isPresent()
                ? NormalizedField.valid(candidate.field(), candidate.value(), candidate.value())
                : NormalizedField.absent(candidate.field());
    }

    private CrossFieldViolation firstViolation(Map<TargetField, NormalizedField> fields) {
        for (CrossFieldRule rule : rules.crossFieldRules()) {
            final Map<TargetField, String> values = new EnumMap<>(TargetField.class);
            boolean allValid = true;
            for (TargetField f : rule.fields()) {
                final NormalizedField nf = fields.get(f);
                if (nf == null || !nf.isValid()) {
                    allValid = false;
                    break;
                }
                values.put(f, nf.value());
            }
            if (allValid && !rule.holds(values)) {
                return new CrossFieldViolation(rule.name(), rule.reason(), rule.fields(),
                        rule.name() + " failed for " + values.values());
            }
        }
        return null;
    }
}
