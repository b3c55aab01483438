/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.normalize;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RulesTest {

    @Test
    void testWhitespaceAndCase() {
        assertEquals("a  b", Rules.trim().apply("  a  b \t"));
        assertEquals(" a b ", Rules.collapseWhitespace().apply("  a \t\n b  "));
        assertEquals("SW1A 1AA", Rules.upperCase().apply("sw1a 1aa"));
        assertEquals("jane", Rules.lowerCase().apply("JaNe"));
    }

    @Test
    void testTitleCase() {
        TransformRule title = Rules.titleCase();
        assertEquals("Jane Doe", title.apply("JANE DOE"));
        assertEquals("Mary-Jane O'Neil", title.apply("mary-jane o'neil"));
        assertEquals("Élodie Brontë", title.apply("élodie BRONTË"));
    }

    @Test
    void testStripPunctuationKeepsHyphenAndApostrophe() {
        assertEquals("Dr Mary-Jane O'Neil", Rules.stripPunctuation().apply("Dr. Mary-Jane O'Neil!"));
    }

    @Test
    void testPostcodeSpacing() {
        TransformRule spacing = Rules.postcodeSpacing();
        assertEquals("SW1A 1AA", spacing.apply("SW1A1AA"));
        assertEquals("M1 1AE", spacing.apply("M 11AE"));
        assertEquals("EC1A 1BB", spacing.apply("EC1A   1BB"));
        // Wrong length is left for validation
        assertEquals("AB1", spacing.apply("AB1"));
        assertEquals("ABCDEFGHI", spacing.apply("ABCDEFGHI"));
    }

    @Test
    void testCorrectionTable() {
        TransformRule correct = Rules.correct("region", Map.of("N YC", "New York", "Londn", "London"));
        assertEquals("New York", correct.apply("N YC"));
        assertEquals("London", correct.apply(" Londn "));
        assertEquals("Paris", correct.apply("Paris"));
        assertEquals("CORRECT(region)", correct.name());
    }

    @Test
    void testDateIsoDefaultPatterns() {
        TransformRule iso = Rules.dateIso();
        assertEquals("2023-05-02", iso.apply("2023-05-02"));
        assertEquals("2023-01-05", iso.apply("01/05/2023"));
        assertEquals("2023-01-05", iso.apply("1/5/2023"));
        assertEquals("2023-05-02", iso.apply("May 2, 2023"));
        assertEquals("2023-03-14", iso.apply("Mar 14, 2023"));
        assertEquals("2023-04-20", iso.apply("20th of April 2023"));
        assertEquals("2023-06-01", iso.apply("1st June 2023"));
        assertEquals("2023-06-01", iso.apply("1 JUNE 2023"));
    }

    @Test
    void testDateIsoIsStrict() {
        TransformRule iso = Rules.dateIso();
        // Not a calendar day: passed through unchanged for validation to reject
        assertEquals("02/30/2023", iso.apply("02/30/2023"));
        assertEquals("2023-02-29", iso.apply("2023-02-29"));
        assertEquals("2024-02-29", iso.apply("2024-02-29"));
        assertEquals("someday", iso.apply("someday"));
    }

    @Test
    void testDateIsoCustomPatterns() {
        TransformRule iso = Rules.dateIso(List.of("d/M/yyyy"));
        assertEquals("2023-05-01", iso.apply("01/05/2023"));
        assertThrows(IllegalArgumentException.class, () -> Rules.dateIso(List.of()));
    }

    @Test
    void testValidators() {
        assertTrue(Validators.isoDate().test("2023-05-02"));
        assertFalse(Validators.isoDate().test("2023-02-30"));
        assertFalse(Validators.isoDate().test("May 2, 2023"));

        assertTrue(Validators.ukPostcode().test("SW1A 1AA"));
        assertTrue(Validators.ukPostcode().test("GIR 0AA"));
        assertTrue(Validators.ukPostcode().test("M1 1AE"));
        assertFalse(Validators.ukPostcode().test("SW1A1AA"));
        assertFalse(Validators.ukPostcode().test("sw1a 1aa"));
        assertFalse(Validators.ukPostcode().test("12345"));

        assertTrue(Validators.personName().test("Mary-Jane O'Neil"));
        assertFalse(Validators.personName().test("R2D2"));
        assertFalse(Validators.personName().test("x".repeat(201)));

        assertTrue(Validators.digits().test("0042"));
        assertFalse(Validators.digits().test("42a"));
        assertTrue(Validators.maxLength(3).test("abc"));
        assertFalse(Validators.maxLength(3).test("abcd"));
        assertTrue(Validators.matches("[A-Z]{2}").test("NY"));

        assertFalse(Validators.notBlank().test(null));
        assertFalse(Validators.notBlank().test("   "));
    }
}
