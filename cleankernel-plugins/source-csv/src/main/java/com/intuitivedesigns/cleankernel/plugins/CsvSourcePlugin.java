/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.plugins;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.SourceConnector;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.sources.CsvSourceConnector;
import com.intuitivedesigns.cleankernel.spi.SourcePlugin;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ID: CSV
 */
public final class CsvSourcePlugin implements SourcePlugin {

    public static final String ID = "CSV";

    // Config keys
    private static final String CFG_PATH = "source.csv.path";
    private static final String CFG_CHARSET = "source.csv.charset";
    private static final String CFG_DELIMITER = "source.csv.delimiter";
    private static final String CFG_STRICT = "source.csv.strict.columns";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SourceConnector<RawRow> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final String rawPath = config.getString(CFG_PATH, null);
        if (rawPath == null || rawPath.isEmpty()) {
            throw new IllegalArgumentException("Missing required configuration key: " + CFG_PATH);
        }
        final Path path = Path.of(rawPath);
        if (!Files.isReadable(path)) {
            throw new IllegalArgumentException("CSV input is not readable: " + path.toAbsolutePath());
        }

        final Charset charset = Charset.forName(config.getString(CFG_CHARSET, "UTF-8"));
        String delimiter = config.getString(CFG_DELIMITER, ",");
        if ("TAB".equalsIgnoreCase(delimiter)) delimiter = "\t";
        if (delimiter.length() != 1) {
            throw new IllegalArgumentException(CFG_DELIMITER + " must be a single character, got '" + delimiter + "'");
        }
        final boolean strict = config.getBoolean(CFG_STRICT, true);

        return CsvSourceConnector.forFile(path, charset, delimiter.charAt(0), strict);
    }
}
