/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.config;

import com.intuitivedesigns.cleankernel.assemble.RetryPolicy;
import com.intuitivedesigns.cleankernel.extract.FieldMapping;
import com.intuitivedesigns.cleankernel.model.TargetField;
import com.intuitivedesigns.cleankernel.normalize.CrossFieldRule;
import com.intuitivedesigns.cleankernel.normalize.RuleTable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Versioned, immutable description of one cleansing job: where each field comes from, how it
 * is normalized, which fields gate acceptance and how commits are retried.
 *
 * <p>{@link Builder#build()} rejects self-contradicting combinations, so every component can
 * trust the instance it is given.</p>
 */
public final class CleansingConfig {

    private final FieldMapping mapping;
    private final RuleTable rules;
    private final List<TargetField> requiredFields;
    private final List<TargetField> identityFields;
    private final RetryPolicy retryPolicy;

    private CleansingConfig(Builder b) {
        this.mapping = b.mapping;
        this.rules = b.rules;
        this.requiredFields = List.copyOf(b.requiredFields);
        this.identityFields = List.copyOf(b.identityFields);
        this.retryPolicy = b.retryPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String version() {
        return rules.version();
    }

    public FieldMapping mapping() {
        return mapping;
    }

    public RuleTable rules() {
        return rules;
    }

    public List<TargetField> requiredFields() {
        return requiredFields;
    }

    public List<TargetField> identityFields() {
        return identityFields;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * Fields that must be valid for a row to be accepted: the required fields in declaration
     * order, then any identity field not already listed.
     */
    public List<TargetField> gatedFields() {
        final Set<TargetField> gated = new LinkedHashSet<>(requiredFields);
        gated.addAll(identityFields);
        return List.copyOf(gated);
    }

    @Override
    public String toString() {
        return "CleansingConfig{version=" + version()
                + ", required=" + requiredFields
                + ", identity=" + identityFields
                + ", retry=" + retryPolicy + "}";
    }

    public static final class Builder {
        private FieldMapping mapping;
        private RuleTable rules;
        private final List<TargetField> requiredFields = new ArrayList<>();
        private final List<TargetField> identityFields = new ArrayList<>();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();

        private Builder() {}

        public Builder mapping(FieldMapping mapping) {
            this.mapping = Objects.requireNonNull(mapping, "mapping");
            return this;
        }

        public Builder rules(RuleTable rules) {
            this.rules = Objects.requireNonNull(rules, "rules");
            return this;
        }

        public Builder required(TargetField... fields) {
            return required(List.of(fields));
        }

        public Builder required(List<TargetField> fields) {
            addUnique(requiredFields, fields, "required");
            return this;
        }

        public Builder identity(TargetField... fields) {
            return identity(List.of(fields));
        }

        public Builder identity(List<TargetField> fields) {
            addUnique(identityFields, fields, "identity");
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public CleansingConfig build() {
            if (mapping == null) throw new ConfigurationException("No field mapping configured");
            if (rules == null) throw new ConfigurationException("No rule table configured");
            if (identityFields.isEmpty()) throw new ConfigurationException("Identity field list is empty");

            for (TargetField f : identityFields) {
                requireMapped(f, "Identity field");
            }
            for (TargetField f : requiredFields) {
                requireMapped(f, "Required field");
            }
            for (TargetField f : rules.chains().keySet()) {
                requireMapped(f, "Rules configured for field");
            }
            for (CrossFieldRule rule : rules.crossFieldRules()) {
                for (TargetField f : rule.fields()) {
                    if (!mapping.isMapped(f)) {
                        throw new ConfigurationException("Cross-field rule " + rule.name()
                                + " references field '" + f + "' which is never extracted");
                    }
                }
            }
            return new CleansingConfig(this);
        }

        private void requireMapped(TargetField f, String what) {
            if (!mapping.isMapped(f)) {
                throw new ConfigurationException(what + " '" + f + "' has no extraction source");
            }
        }

        private static void addUnique(List<TargetField> target, List<TargetField> fields, String what) {
            for (TargetField f : fields) {
                Objects.requireNonNull(f, what + " field");
                if (target.contains(f)) {
                    throw new ConfigurationException("Field '" + f + "' listed twice in " + what + " fields");
                }
                target.add(f);
            }
        }
    }
}
