/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.core;

import com.intuitivedesigns.cleankernel.model.RawRow;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelinePayloadTest {

    @Test
    void testImmutability() {
        // Setup
        RawRow row = RawRow.of(17, Map.of("Full Name", "john doe"));
        Map<String, String> meta = new HashMap<>(Map.of("source", "legacy.csv"));

        // Act
        PipelinePayload<RawRow> payload = new PipelinePayload<>(row.rowId(), row, meta);
        meta.put("source", "changed");

        // Assert
        assertEquals("row-17", payload.id());
        assertSame(row, payload.data());
        assertEquals(Map.of("source", "legacy.csv"), payload.metadata());
        assertThrows(UnsupportedOperationException.class, () -> payload.metadata().put("x", "y"));
    }

    @Test
    void testMetadataNeverNull() {
        assertTrue(new PipelinePayload<>("row-1", "data").metadata().isEmpty());
        assertTrue(new PipelinePayload<>("row-1", "data", null).metadata().isEmpty());
    }

    @Test
    void testNullIdRejected() {
        assertThrows(NullPointerException.class, () -> new PipelinePayload<>(null, "data"));
    }
}
