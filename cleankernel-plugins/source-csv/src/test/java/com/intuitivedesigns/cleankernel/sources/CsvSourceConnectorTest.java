/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.sources;

import com.intuitivedesigns.cleankernel.core.PipelinePayload;
import com.intuitivedesigns.cleankernel.model.RawRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvSourceConnectorTest {

    private static List<RawRow> readAll(String csv, boolean strict) {
        CsvSourceConnector source = new CsvSourceConnector(() -> new StringReader(csv), "test.csv", ',', strict);
        List<RawRow> rows = new ArrayList<>();
        source.connect();
        try {
            PipelinePayload<RawRow> p;
            while ((p = source.fetch()) != null) {
                rows.add(p.data());
            }
        } finally {
            source.disconnect();
        }
        return rows;
    }

    @Test
    void testRowsKeyedByHeader() {
        // Act
        List<RawRow> rows = readAll("ID,Full Name,Signup Date\n"
                + "1001,\"Doe, Jane\",May 2 2023\n"
                + "\n"
                + "1002,John Smith,\n", true);

        // Assert
        assertEquals(2, rows.size());
        RawRow first = rows.get(0);
        assertEquals(1, first.rowNumber());
        assertEquals("row-1", first.rowId());
        assertEquals("Doe, Jane", first.values().get("Full Name"));
        assertEquals(List.of("ID", "Full Name", "Signup Date"), List.copyOf(first.values().keySet()));
        assertEquals("", rows.get(1).values().get("Signup Date"));
        assertEquals(2, rows.get(1).rowNumber());
    }

    @Test
    void testColumnCountMismatchIsMalformedWhenStrict() {
        List<RawRow> rows = readAll("A,B,C\n1,2,3\n1,2,3,4\n1,2\n", true);

        assertEquals(3, rows.size());
        assertFalse(rows.get(0).isMalformed());
        assertEquals("expected 3 columns, found 4", rows.get(1).structuralError().orElseThrow());
        assertTrue(rows.get(2).isMalformed());
        assertEquals(3, rows.get(2).rowNumber());
    }

    @Test
    void testLenientColumnsPadAndDrop() {
        List<RawRow> rows = readAll("A,B,C\n1,2,3,4\n1\n", false);

        assertEquals("3", rows.get(0).values().get("C"));
        assertEquals(3, rows.get(0).values().size());
        assertNull(rows.get(1).values().get("B"));
        assertTrue(rows.get(1).values().containsKey("B"));
    }

    @Test
    void testDuplicateHeaderKeepsFirstColumn() {
        List<RawRow> rows = readAll("Name,Name\nfirst,second\n", true);

        assertEquals("first", rows.get(0).values().get("Name"));
    }

    @Test
    void testEmptyInput() {
        assertTrue(readAll("", true).isEmpty());
        assertTrue(readAll("A,B\n", true).isEmpty());
    }

    @Test
    void testUnterminatedQuoteEndsInput() {
        List<RawRow> rows = readAll("A,B\n1,2\n3,\"never closed\n4,5\n", true);

        assertEquals(2, rows.size());
        assertFalse(rows.get(0).isMalformed());
        assertTrue(rows.get(1).isMalformed());
        assertTrue(rows.get(1).structuralError().orElseThrow().startsWith("unreadable CSV"));
    }

    @Test
    void testByteOrderMarkStrippedFromFirstLabel(@TempDir Path dir) throws Exception {
        // Setup
        Path file = dir.resolve("export.csv");
        Files.writeString(file, "\uFEFFInternal ID,Full Name\n1001,john doe\n", StandardCharsets.UTF_8);
        CsvSourceConnector source = CsvSourceConnector.forFile(file, StandardCharsets.UTF_8, ',', true);

        // Act
        source.connect();
        PipelinePayload<RawRow> p = source.fetch();
        source.disconnect();

        // Assert
        assertEquals(List.of("Internal ID", "Full Name"), List.copyOf(p.data().values().keySet()));
        assertEquals("1001", p.data().values().get("Internal ID"));
    }

    @Test
    void testMetadataAndFileSource(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("signups.tsv");
        Files.writeString(file, "Name\tCity\nZoë\tLondon\n", StandardCharsets.UTF_8);

        CsvSourceConnector source = CsvSourceConnector.forFile(file, StandardCharsets.UTF_8, '\t', true);
        source.connect();
        PipelinePayload<RawRow> p = source.fetch();
        source.disconnect();

        assertEquals("Zoë", p.data().values().get("Name"));
        assertEquals("signups.tsv", p.metadata().get(CsvSourceConnector.METADATA_SOURCE));
    }

    @Test
    void testFetchBeforeConnect() {
        CsvSourceConnector source = new CsvSourceConnector(() -> new StringReader("A\n1\n"), "x", ',', true);

        assertThrows(IllegalStateException.class, source::fetch);
    }

    @Test
    void testReconnectRereadsFromStart() {
        CsvSourceConnector source = new CsvSourceConnector(() -> new StringReader("A\n1\n2\n"), "x", ',', true);

        source.connect();
        source.fetch();
        source.disconnect();
        source.connect();
        PipelinePayload<RawRow> again = source.fetch();
        source.disconnect();

        assertEquals(1, again.data().rowNumber());
        assertEquals("1", again.data().values().get("A"));
    }
}
