/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.core;

import java.util.Map;
import java.util.Objects;

/**
 * The envelope a source hands to the pipeline.
 *
 * Design Principles:
 * - Immutability: Thread-safe by default.
 * - Provenance: The id is the row identifier used in every outcome and dead letter.
 * - Extensibility: Arbitrary metadata (source file, sheet name) without changing the row model.
 *
 * @param id Stable row identifier (e.g. "row-17").
 * @param data The row content.
 * @param metadata Context such as the originating file.
 */
public record PipelinePayload<T>(
        String id,
        T data,
        Map<String, String> metadata
) {

    public PipelinePayload {
        Objects.requireNonNull(id, "PipelinePayload id cannot be null");

        // Ensure metadata is immutable and never null
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }

    public PipelinePayload(String id, T data) {
        this(id, data, Map.of());
    }
}
