/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import com.intuitivedesigns.cleankernel.config.ConfigurationException;
import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.TargetField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    private final RuleRegistry registry = new RuleRegistry(Map.of("Region", Map.of("N YC", "New York")));

    @Test
    void testTransformsByName() {
        assertEquals("abc", registry.transform("trim").apply(" abc "));
        assertEquals("ABC", registry.transform(" UPPERCASE ").apply("abc"));
        assertEquals("New York", registry.transform("CORRECT(region)").apply("N YC"));
        assertEquals("2023-05-01", registry.transform("DATE_ISO(d/M/yyyy | yyyy-MM-dd)").apply("1/5/2023"));
        assertEquals("2023-05-02", registry.transform("DATE_ISO").apply("May 2, 2023"));
    }

    @Test
    void testValidationsByName() {
        assertTrue(registry.isValidation("UK_POSTCODE"));
        assertTrue(registry.isValidation("max_length(5)"));
        assertFalse(registry.isValidation("TRIM"));

        assertEquals(ReasonCode.MALFORMED_DATE, registry.validation("ISO_DATE").reason());
        assertTrue(registry.validation("MAX_LENGTH(5)").test("abcde"));
        assertFalse(registry.validation("MAX_LENGTH(5)").test("abcdef"));
        assertTrue(registry.validation("MATCHES([0-9]{3})").test("123"));
    }

    @Test
    void testCrossField() {
        CrossFieldRule rule = registry.crossField("DATE_ORDER(date_of_event, end_date)");
        assertEquals(List.of(TargetField.DATE_OF_EVENT, TargetField.END_DATE), rule.fields());
        assertEquals(ReasonCode.DATE_RANGE_INVERTED, rule.reason());

        CrossFieldRule custom = registry.crossField("DATE_ORDER(date_of_event,end_date,CROSS_FIELD_INVALID)");
        assertEquals(ReasonCode.CROSS_FIELD_INVALID, custom.reason());
        assertFalse(custom.holds(Map.of(TargetField.DATE_OF_EVENT, "2023-05-02", TargetField.END_DATE, "2023-01-01")));
    }

    @Test
    void testBadExpressions() {
        assertThrows(ConfigurationException.class, () -> registry.transform("SHOUT"));
        assertThrows(ConfigurationException.class, () -> registry.transform("UK_POSTCODE"));
        assertThrows(ConfigurationException.class, () -> registry.transform("TRIM(x)"));
        assertThrows(ConfigurationException.class, () -> registry.transform("CORRECT(cities)"));
        assertThrows(ConfigurationException.class, () -> registry.transform("CORRECT()"));
        assertThrows(ConfigurationException.class, () -> registry.transform("DATE_ISO(bogus pattern {)"));
        assertThrows(ConfigurationException.class, () -> registry.transform("DATE_ISO("));
        assertThrows(ConfigurationException.class, () -> registry.transform(" "));
        assertThrows(ConfigurationException.class, () -> registry.validation("MAX_LENGTH(ten)"));
        assertThrows(ConfigurationException.class, () -> registry.validation("MATCHES([a-)"));
        assertThrows(ConfigurationException.class, () -> registry.validation("TRIM"));
        assertThrows(ConfigurationException.class, () -> registry.crossField("DATE_ORDER(date_of_event)"));
        assertThrows(ConfigurationException.class, () -> registry.crossField("DATE_ORDER(date_of_event,date_of_event)"));
        assertThrows(ConfigurationException.class, () -> registry.crossField("DATE_ORDER(start,end_date)"));
        assertThrows(ConfigurationException.class, () -> registry.crossField("DATE_ORDER(date_of_event,end_date,bad reason)"));
        assertThrows(ConfigurationException.class, () -> registry.crossField("SAME_AS(a,b)"));
    }
}
