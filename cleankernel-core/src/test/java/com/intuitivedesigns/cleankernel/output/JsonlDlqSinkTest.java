/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.RowOutcome;
import com.intuitivedesigns.cleankernel.model.TargetField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonlDlqSinkTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void testOneLinePerRejectedRow(@TempDir Path dir) throws Exception {
        // Setup
        Path file = dir.resolve("dlq/rejected.jsonl");
        Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("Full Name", "Jane Doe");
        cells.put("Signup Date", "02/30/2023");
        cells.put("Region", null);

        // Act
        try (JsonlDlqSink sink = new JsonlDlqSink(file, false)) {
            sink.write(RowOutcome.rejected("row-2", 2, ReasonCode.MALFORMED_DATE, TargetField.DATE_OF_EVENT,
                    "required field 'date_of_event' failed validation"), RawRow.of(2, cells));
            sink.write(RowOutcome.rejected("row-5", 5, ReasonCode.MALFORMED_ROW, null, "short row"),
                    RawRow.malformed(5, "expected 5 columns, found 3"));
        }

        // Assert
        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());

        JsonNode first = json.readTree(lines.get(0));
        assertEquals("row-2", first.get("rowId").asText());
        assertEquals(2, first.get("rowNumber").asLong());
        assertEquals("REJECTED", first.get("status").asText());
        assertEquals("MALFORMED_DATE", first.get("reason").asText());
        assertEquals("date_of_event", first.get("field").asText());
        assertEquals("02/30/2023", first.get("row").get("Signup Date").asText());
        assertTrue(first.get("row").get("Region").isNull());

        JsonNode second = json.readTree(lines.get(1));
        assertEquals("expected 5 columns, found 3", second.get("structuralError").asText());
        assertFalse(second.has("field"));
    }

    @Test
    void testAppendKeepsEarlierLines(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("dlq.jsonl");
        RowOutcome outcome = RowOutcome.rejected("row-1", 1, ReasonCode.INVALID_NAME, TargetField.FULL_NAME, "bad");

        try (JsonlDlqSink sink = new JsonlDlqSink(file, false)) {
            sink.write(outcome, RawRow.of(1, Map.of("Full Name", "R2D2")));
        }
        try (JsonlDlqSink sink = new JsonlDlqSink(file, true)) {
            sink.write(outcome, RawRow.of(1, Map.of("Full Name", "R2D2")));
        }
        assertEquals(2, Files.readAllLines(file).size());

        try (JsonlDlqSink sink = new JsonlDlqSink(file, false)) {
            sink.write(outcome, null);
        }
        assertEquals(1, Files.readAllLines(file).size());
    }

    @Test
    void testLogSinkNeverThrows() {
        LogDlqSink sink = new LogDlqSink("INFO", 16, true);

        assertDoesNotThrow(() -> sink.write(
                RowOutcome.rejected("row-1", 1, ReasonCode.INVALID_NAME, TargetField.FULL_NAME, "x".repeat(100)),
                RawRow.of(1, Map.of("Full Name", "R2D2"))));
        assertDoesNotThrow(() -> new LogDlqSink("bogus", 0, false).write(
                RowOutcome.rejected("row-2", 2, ReasonCode.MALFORMED_ROW, null, null), null));
    }
}
