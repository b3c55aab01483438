/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A lazy, finite source of rows for the pipeline.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #fetch()} returns {@code null} once the input is exhausted.</li>
 * <li>Rows must be returned in a stable order so reruns are reproducible.</li>
 * <li>A source that meets an unreadable record should return a structurally malformed row
 * rather than throw, wherever the underlying format allows it.</li>
 * </ul>
 *
 * @param <T> Raw data type produced by this source.
 */
public interface SourceConnector<T> {

    void connect();

    void disconnect();

    PipelinePayload<T> fetch();

    default List<PipelinePayload<T>> fetchBatch(int maxBatchSize) {
        if (maxBatchSize <= 0) return Collections.emptyList();

        if (maxBatchSize == 1) {
            PipelinePayload<T> one = fetch();
            return (one == null) ? Collections.emptyList() : Collections.singletonList(one);
        }

        PipelinePayload<T> first = fetch();
        if (first == null) return Collections.emptyList();

        List<PipelinePayload<T>> batch = new ArrayList<>(maxBatchSize);
        batch.add(first);

        for (int i = 1; i < maxBatchSize; i++) {
            PipelinePayload<T> next = fetch();
            if (next == null) break;
            batch.add(next);
        }

        return batch;
    }
}
