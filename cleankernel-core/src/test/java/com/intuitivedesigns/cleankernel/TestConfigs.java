/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel;

import com.intuitivedesigns.cleankernel.assemble.RetryPolicy;
import com.intuitivedesigns.cleankernel.config.CleansingConfig;
import com.intuitivedesigns.cleankernel.extract.ExtractorKind;
import com.intuitivedesigns.cleankernel.extract.FieldMapping;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.TargetField;
import com.intuitivedesigns.cleankernel.normalize.CrossFieldRule;
import com.intuitivedesigns.cleankernel.normalize.FieldRuleChain;
import com.intuitivedesigns.cleankernel.normalize.RuleTable;
import com.intuitivedesigns.cleankernel.normalize.Rules;
import com.intuitivedesigns.cleankernel.normalize.Validators;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared fixtures: a signup-style job keyed on name and postcode.
 */
public final class TestConfigs {

    public static final String VERSION = "test-1";

    private TestConfigs() {}

    public static FieldMapping mapping() {
        return FieldMapping.builder()
                .map(TargetField.EXTERNAL_ID, "ID", ExtractorKind.IDENTIFIER)
                .map(TargetField.FULL_NAME, "Full Name")
                .map(TargetField.FULL_NAME, "Name")
                .map(TargetField.DATE_OF_EVENT, "Signup Date")
                .map(TargetField.END_DATE, "End Date")
                .map(TargetField.POSTCODE, "Postcode")
                .map(TargetField.REGION, "Region")
                .build();
    }

    public static RuleTable rules() {
        return RuleTable.builder(VERSION)
                .chain(FieldRuleChain.builder(TargetField.FULL_NAME)
                        .transform(Rules.trim())
                        .transform(Rules.collapseWhitespace())
                        .transform(Rules.titleCase())
                        .validate(Validators.personName())
                        .build())
                .chain(FieldRuleChain.builder(TargetField.DATE_OF_EVENT)
                        .transform(Rules.trim())
                        .transform(Rules.dateIso())
                        .validate(Validators.isoDate())
                        .build())
                .chain(FieldRuleChain.builder(TargetField.END_DATE)
                        .transform(Rules.trim())
                        .transform(Rules.dateIso())
                        .validate(Validators.isoDate())
                        .build())
                .chain(FieldRuleChain.builder(TargetField.POSTCODE)
                        .transform(Rules.trim())
                        .transform(Rules.upperCase())
                        .transform(Rules.postcodeSpacing())
                        .validate(Validators.ukPostcode())
                        .build())
                .chain(FieldRuleChain.builder(TargetField.REGION)
                        .transform(Rules.trim())
                        .transform(Rules.correct("region", Map.of("N YC", "New York")))
                        .validate(Validators.notBlank())
                        .build())
                .crossField(CrossFieldRule.dateOrder(TargetField.DATE_OF_EVENT, TargetField.END_DATE,
                        ReasonCode.DATE_RANGE_INVERTED))
                .build();
    }

    public static RetryPolicy fastRetry() {
        return new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(40), Duration.ofSeconds(1));
    }

    public static CleansingConfig config() {
        return CleansingConfig.builder()
                .mapping(mapping())
                .rules(rules())
                .required(TargetField.FULL_NAME, TargetField.DATE_OF_EVENT)
                .identity(TargetField.FULL_NAME, TargetField.POSTCODE)
                .retryPolicy(fastRetry())
                .build();
    }

    /** A row in the shape the fixtures map: name, signup date, postcode, optional region. */
    public static RawRow row(long n, String name, String date, String postcode) {
        return row(n, name, date, postcode, "London");
    }

    public static RawRow row(long n, String name, String date, String postcode, String region) {
        final Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("ID", String.valueOf(1000 + n));
        cells.put("Full Name", name);
        cells.put("Signup Date", date);
        cells.put("Postcode", postcode);
        cells.put("Region", region);
        return RawRow.of(n, cells);
    }
}
