/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void testTypedGettersFallBackToDefaults() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "pipeline.parallelism", " 4 ",
                "pipeline.batch.size", "many",
                "pipeline.source.fail.fast", "true"));

        assertEquals(4, config.getInt("pipeline.parallelism", 1));
        assertEquals(500, config.getInt("pipeline.batch.size", 500));
        assertEquals(7L, config.getLong("missing", 7L));
        assertTrue(config.getBoolean("pipeline.source.fail.fast", false));
        assertNull(config.getString("missing", null));
    }

    @Test
    void testListKeepsRuleArgumentsTogether() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "rules.date_of_event", "TRIM, DATE_ISO(MMMM d, yyyy|M/d/yyyy), , ISO_DATE",
                "cross.rules", "DATE_ORDER(date_of_event,end_date)"));

        assertEquals(List.of("TRIM", "DATE_ISO(MMMM d, yyyy|M/d/yyyy)", "ISO_DATE"), config.getList("rules.date_of_event"));
        assertEquals(List.of("DATE_ORDER(date_of_event,end_date)"), config.getList("cross.rules"));
        assertTrue(config.getList("missing").isEmpty());
    }

    @Test
    void testWithPrefixStripsAndSorts() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "correction.region.N YC", "New York",
                "correction.region.chicago", "Chicago",
                "correction.", "ignored",
                "other", "x"));

        Map<String, String> corrections = config.withPrefix("correction.");
        assertEquals(List.of("region.N YC", "region.chicago"), List.copyOf(corrections.keySet()));
        assertEquals("New York", corrections.get("region.N YC"));
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("cleankernel.properties");
        Files.writeString(file, "cleansing.version=2024.1\ncorrection.region.N\\ YC=New York\n");

        PipelineConfig config = PipelineConfig.load(file);

        assertEquals("2024.1", config.getString("cleansing.version", null));
        assertEquals("New York", config.getString("correction.region.N YC", null));
        assertThrows(UncheckedIOException.class, () -> PipelineConfig.load(dir.resolve("missing.properties")));
    }
}
