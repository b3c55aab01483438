/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.plugins;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.PipelinePayload;
import com.intuitivedesigns.cleankernel.core.SourceConnector;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.spi.PluginCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvSourcePluginTest {

    @Test
    void testDiscoveredByServiceLoader() {
        PluginCatalog catalog = new PluginCatalog(getClass().getClassLoader());

        assertTrue(catalog.sources().get("csv").isPresent());
        assertInstanceOf(CsvSourcePlugin.class, catalog.sources().require("CSV", "source.type"));
    }

    @Test
    void testTabDelimitedAndLenient(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("in.tsv");
        Files.writeString(file, "A\tB\n1\n", StandardCharsets.UTF_8);
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "source.csv.path", file.toString(),
                "source.csv.delimiter", "TAB",
                "source.csv.strict.columns", "false"));

        SourceConnector<RawRow> source = new CsvSourcePlugin().create(config, MetricsRuntime.NOOP);
        source.connect();
        PipelinePayload<RawRow> p = source.fetch();
        source.disconnect();

        assertFalse(p.data().isMalformed());
        assertEquals("1", p.data().values().get("A"));
    }

    @Test
    void testStrictByDefault(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("in.csv");
        Files.writeString(file, "A,B\n1\n", StandardCharsets.UTF_8);

        SourceConnector<RawRow> source = new CsvSourcePlugin().create(
                PipelineConfig.fromMap(Map.of("source.csv.path", file.toString())), MetricsRuntime.NOOP);
        source.connect();
        PipelinePayload<RawRow> p = source.fetch();
        source.disconnect();

        assertTrue(p.data().isMalformed());
    }

    @Test
    void testBadSettings(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("in.csv");
        Files.writeString(file, "A\n", StandardCharsets.UTF_8);
        CsvSourcePlugin plugin = new CsvSourcePlugin();

        assertThrows(IllegalArgumentException.class,
                () -> plugin.create(PipelineConfig.fromMap(Map.of()), MetricsRuntime.NOOP));
        assertThrows(IllegalArgumentException.class,
                () -> plugin.create(PipelineConfig.fromMap(Map.of("source.csv.path", dir.resolve("missing.csv").toString())),
                        MetricsRuntime.NOOP));
        assertThrows(IllegalArgumentException.class,
                () -> plugin.create(PipelineConfig.fromMap(Map.of(
                        "source.csv.path", file.toString(),
                        "source.csv.delimiter", ";;")), MetricsRuntime.NOOP));
    }
}
