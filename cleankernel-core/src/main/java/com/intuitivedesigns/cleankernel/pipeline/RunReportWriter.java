/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.cleankernel.model.RowOutcome;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Renders a {@link RunSummary} as a JSON audit report.
 */
public final class RunReportWriter {

    private final ObjectMapper json;
    private final boolean includeOutcomes;

    public RunReportWriter() {
        this(true);
    }

    public RunReportWriter(boolean includeOutcomes) {
        this.json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.includeOutcomes = includeOutcomes;
    }

    public ObjectNode toJson(RunSummary summary, String configVersion) {
        Objects.requireNonNull(summary, "summary");
        final ObjectNode root = json.createObjectNode();
        root.put("status", summary.status().name());
        if (configVersion != null) root.put("configVersion", configVersion);
        if (summary.abortCause() != null) root.put("abortCause", summary.abortCause());
        root.put("total", summary.total());
        root.put("accepted", summary.accepted());
        root.put("duplicates", summary.duplicates());
        root.put("rejected", summary.rejected());

        final ObjectNode byReason = root.putObject("rejectedByReason");
        summary.rejectedByReason().forEach((reason, n) -> byReason.put(reason.name(), n));

        if (includeOutcomes) {
            final ArrayNode outcomes = root.putArray("outcomes");
            for (RowOutcome o : summary.outcomes()) {
                outcomes.add(outcome(o));
            }
        }
        return root;
    }

    public String render(RunSummary summary, String configVersion) {
        try {
            return json.writeValueAsString(toJson(summary, configVersion));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render run report", e);
        }
    }

    public void write(RunSummary summary, String configVersion, Path target) {
        try {
            final Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(target, render(summary, configVersion), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write run report to " + target, e);
        }
    }

    private ObjectNode outcome(RowOutcome o) {
        final ObjectNode n = json.createObjectNode();
        n.put("rowId", o.rowId());
        n.put("rowNumber", o.rowNumber());
        n.put("status", o.status().name());
        if (o.reason() != null) n.put("reason", o.reason().name());
        if (o.field() != null) n.put("field", o.field().wireName());
        if (o.detail() != null) n.put("detail", o.detail());
        if (o.duplicateOf() != null) n.put("duplicateOf", o.duplicateOf());
        if (o.destinationId() != null) n.put("destinationId", o.destinationId());
        if (!o.warnings().isEmpty()) {
            final ArrayNode w = n.putArray("warnings");
            o.warnings().forEach(w::add);
        }
        return n;
    }
}
