/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.cleankernel.core.DlqSink;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.model.RowOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;

/**
 * Appends one JSON object per rejected row to a file: the outcome plus the row as read.
 */
public final class JsonlDlqSink implements DlqSink {

    private static final Logger log = LoggerFactory.getLogger(JsonlDlqSink.class);

    private final ObjectMapper json = new ObjectMapper();
    private final Path path;
    private final BufferedWriter writer;
    private long written;

    public JsonlDlqSink(Path path, boolean append) throws IOException {
        this.path = Objects.requireNonNull(path, "path");
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.writer = append
                ? Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
                : Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        log.info("JSONL dead-letter sink writing to {}", path);
    }

    @Override
    public synchronized void write(RowOutcome outcome, RawRow row) throws IOException {
        final ObjectNode n = json.createObjectNode();
        n.put("rowId", outcome.rowId());
        n.put("rowNumber", outcome.rowNumber());
        n.put("status", outcome.status().name());
        if (outcome.reason() != null) n.put("reason", outcome.reason().name());
        if (outcome.field() != null) n.put("field", outcome.field().wireName());
        if (outcome.detail() != null) n.put("detail", outcome.detail());

        if (row != null) {
            row.structuralError().ifPresent(e -> n.put("structuralError", e));
            final ObjectNode values = n.putObject("row");
            for (Map.Entry<String, Object> e : row.values().entrySet()) {
                values.put(String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
            }
        }

        writer.write(json.writeValueAsString(n));
        writer.newLine();
        written++;
    }

    @Override
    public synchronized void flush() throws IOException {
        writer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
        log.info("JSONL dead-letter sink closed: {} rows in {}", written, path);
    }
}
