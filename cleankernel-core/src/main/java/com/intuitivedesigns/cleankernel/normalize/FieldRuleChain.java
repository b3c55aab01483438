/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.config.ConfigurationException;
import com.intuitivedesigns.cleankernel.extract.CandidateField;
import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered transformations followed by exactly one validation.
 *
 * <p>Each transformation receives the previous one's output. The builder only accepts
 * transformations before the validation, so a chain that validates before it corrects cannot
 * be built.</p>
 */
public final class FieldRuleChain {

    private final TargetField field;
    private final List<TransformRule> transforms;
    private final ValidationRule validation;

    private FieldRuleChain(TargetField field, List<TransformRule> transforms, ValidationRule validation) {
        this.field = field;
        this.transforms = List.copyOf(transforms);
        this.validation = validation;
    }

    public static Builder builder(TargetField field) {
        return new Builder(field);
    }

    public TargetField field() {
        return field;
    }

    public List<TransformRule> transforms() {
        return transforms;
    }

    public ValidationRule validation() {
        return validation;
    }

    public NormalizedField apply(CandidateField candidate) {
        if (candidate == null || !candidate.isPresent()) {
            return NormalizedField.absent(field);
        }

        final String original = candidate.value();
        String current = original;
        for (TransformRule rule : transforms) {
            current = rule.apply(current);
            if (current == null || current.isBlank()) {
                return NormalizedField.invalid(field, current, validation.reason(), original);
            }
        }

        return validation.test(current)
                ? NormalizedField.valid(field, current, original)
                : NormalizedField.invalid(field, current, validation.reason(), original);
    }

    @Override
    public String toString() {
        return field + transforms.toString() + " => " + validation;
    }

    public static final class Builder {
        private final TargetField field;
        private final List<TransformRule> transforms = new ArrayList<>();
        private ValidationRule validation;

        private Builder(TargetField field) {
            this.field = Objects.requireNonNull(field, "field");
        }

        public Builder transform(TransformRule rule) {
            Objects.requireNonNull(rule, "rule");
            if (validation != null) {
                throw new ConfigurationException("Rule '" + rule.name() + "' for " + field
                        + " comes after validation '" + validation.name() + "'; validation must be the last rule");
            }
            transforms.add(rule);
            return this;
        }

        public Builder validate(ValidationRule rule) {
            Objects.requireNonNull(rule, "rule");
            if (validation != null) {
                throw new ConfigurationException("Field " + field + " already validated by '" + validation.name() + "'");
            }
            this.validation = rule;
            return this;
        }

        public FieldRuleChain build() {
            if (validation == null) {
                throw new ConfigurationException("Rule chain for " + field + " has no terminal validation");
            }
            return new FieldRuleChain(field, transforms, validation);
        }
    }
}
