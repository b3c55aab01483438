/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.extract;

import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.model.TargetField;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pulls candidate fields out of a raw row.
 *
 * <p>For every mapped field the configured sources are tried in order and the first one that
 * yields a value wins. Missing columns, blanks and failed coercions leave the field absent;
 * only a row that is not a mapping at all is reported as malformed. Pure and deterministic.</p>
 */
public final class FieldExtractor {

    private final FieldMapping mapping;

    public FieldExtractor(FieldMapping mapping) {
        this.mapping = Objects.requireNonNull(mapping, "mapping");
    }

    /**
     * Entry point for payload data of unknown shape.
     */
    public ExtractionResult extract(Object data) {
        if (data == null) return ExtractionResult.malformed("row has no content");
        if (data instanceof RawRow row) return extract(row);
        if (data instanceof Map<?, ?> map) {
            final Map<String, Object> values = new LinkedHashMap<>();
            map.forEach((k, v) -> values.put(k == null ? null : String.valueOf(k), v));
            return extract(RawRow.of(0, values));
        }
        return ExtractionResult.malformed("row is not a mapping: " + data.getClass().getSimpleName());
    }

    public ExtractionResult extract(RawRow row) {
        if (row == null) return ExtractionResult.malformed("row has no content");
        if (row.isMalformed()) return ExtractionResult.malformed(row.structuralError().orElse("unreadable row"));

        final Map<String, Map.Entry<String, Object>> byLabel = indexColumns(row);
        final List<CandidateField> out = new ArrayList<>(mapping.fields().size());

        for (TargetField field : mapping.fields()) {
            out.add(extractField(field, byLabel));
        }
        return ExtractionResult.ok(CandidateFieldSet.of(out));
    }

    private CandidateField extractField(TargetField field, Map<String, Map.Entry<String, Object>> byLabel) {
        Map.Entry<String, Object> firstSeen = null;

        for (SourceBinding binding : mapping.bindings(field)) {
            final Map.Entry<String, Object> cell = byLabel.get(binding.normalizedColumn());
            if (cell == null) continue;
            if (firstSeen == null) firstSeen = cell;

            final Optional<String> value = binding.extractor().extract(cell.getValue());
            if (value.isPresent()) {
                return CandidateField.present(field, value.get(), cell.getKey(), cell.getValue());
            }
        }

        return (firstSeen == null)
                ? CandidateField.absent(field)
                : CandidateField.absent(field, firstSeen.getKey(), firstSeen.getValue());
    }

    // First occurrence of a label wins when two headers normalize to the same text
    private static Map<String, Map.Entry<String, Object>> indexColumns(RawRow row) {
        final Map<String, Map.Entry<String, Object>> index = new HashMap<>();
        for (Map.Entry<String, Object> e : row.values().entrySet()) {
            index.putIfAbsent(SourceBinding.normalizeLabel(e.getKey()), e);
        }
        return index;
    }
}
