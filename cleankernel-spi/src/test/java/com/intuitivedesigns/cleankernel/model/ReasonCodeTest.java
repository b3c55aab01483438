/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ReasonCodeTest {

    @Test
    void testCustomCodesEqualBuiltIns() {
        assertEquals(ReasonCode.MALFORMED_DATE, ReasonCode.of(" MALFORMED_DATE "));
        assertEquals("MALFORMED_DATE", ReasonCode.MALFORMED_DATE.toString());
    }

    @Test
    void testRejectsFreeText() {
        assertThrows(IllegalArgumentException.class, () -> ReasonCode.of("bad date"));
        assertThrows(IllegalArgumentException.class, () -> ReasonCode.of("Malformed_Date"));
        assertThrows(NullPointerException.class, () -> ReasonCode.of(null));
    }

    @Test
    void testOrderedByName() {
        TreeSet<ReasonCode> codes = new TreeSet<>(List.of(
                ReasonCode.WRITE_FAILED, ReasonCode.MALFORMED_DATE, ReasonCode.DATE_RANGE_INVERTED));
        assertEquals(List.of(ReasonCode.DATE_RANGE_INVERTED, ReasonCode.MALFORMED_DATE, ReasonCode.WRITE_FAILED),
                List.copyOf(codes));
    }

    @Test
    void testRejectedOutcomeNeedsReason() {
        assertThrows(IllegalArgumentException.class, () -> new RowOutcome("row-1", 1, RowOutcome.Status.REJECTED,
                null, null, null, null, null, null));

        RowOutcome dup = RowOutcome.duplicate("row-7", 7, "row-1");
        assertEquals("row-1", dup.duplicateOf());
        assertFalse(dup.isRejected());
        assertTrue(dup.warnings().isEmpty());
    }

    @Test
    void testTargetFieldWireNames() {
        assertEquals(TargetField.DATE_OF_EVENT, TargetField.fromWireName(" Date_Of_Event").orElseThrow());
        assertTrue(TargetField.fromWireName("signup_date").isEmpty());
        assertEquals(FieldType.POSTCODE, TargetField.POSTCODE.type());
    }
}
