/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.config.ConfigurationException;
import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Versioned, immutable set of rule chains and cross-field rules.
 */
public final class RuleTable {

    private final String version;
    private final Map<TargetField, FieldRuleChain> chains;
    private final List<CrossFieldRule> crossFieldRules;

    private RuleTable(String version, Map<TargetField, FieldRuleChain> chains, List<CrossFieldRule> crossFieldRules) {
        this.version = version;
        this.chains = chains;
        this.crossFieldRules = crossFieldRules;
    }

    public static Builder builder(String version) {
        return new Builder(version);
    }

    public String version() {
        return version;
    }

    public Optional<FieldRuleChain> chain(TargetField field) {
        return Optional.ofNullable(chains.get(field));
    }

    public Map<TargetField, FieldRuleChain> chains() {
        return chains;
    }

    public List<CrossFieldRule> crossFieldRules() {
        return crossFieldRules;
    }

    /**
     * Every code this table can produce, for reporting.
     */
    public SortedSet<ReasonCode> reasonCodes() {
        final SortedSet<ReasonCode> codes = new TreeSet<>();
        chains.values().forEach(c -> codes.add(c.validation().reason()));
        crossFieldRules.forEach(r -> codes.add(r.reason()));
        return Collections.unmodifiableSortedSet(codes);
    }

    public static final class Builder {
        private final String version;
        private final Map<TargetField, FieldRuleChain> chains = new EnumMap<>(TargetField.class);
        private final List<CrossFieldRule> crossFieldRules = new ArrayList<>();

        private Builder(String version) {
            if (version == null || version.isBlank()) {
                throw new ConfigurationException("Rule table version must not be blank");
            }
            this.version = version.trim();
        }

        public Builder chain(FieldRuleChain chain) {
            Objects.requireNonNull(chain, "chain");
            if (chains.putIfAbsent(chain.field(), chain) != null) {
                throw new ConfigurationException("Duplicate rule chain for " + chain.field());
            }
            return this;
        }

        public Builder crossField(CrossFieldRule rule) {
            crossFieldRules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public RuleTable build() {
            return new RuleTable(version,
                    Collections.unmodifiableMap(new EnumMap<>(chains)),
                    List.copyOf(crossFieldRules));
        }
    }
}
