/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.source;

import com.intuitivedesigns.cleankernel.core.PipelinePayload;
import com.intuitivedesigns.cleankernel.core.SourceConnector;
import com.intuitivedesigns.cleankernel.model.RawRow;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serves rows from an in-memory collection, in iteration order.
 */
public final class IterableSourceConnector implements SourceConnector<RawRow> {

    private final Iterable<RawRow> rows;
    private Iterator<RawRow> cursor;

    public IterableSourceConnector(Iterable<RawRow> rows) {
        this.rows = Objects.requireNonNull(rows, "rows");
    }

    /** Rows numbered from 1 in list order. */
    public static IterableSourceConnector ofMaps(List<? extends Map<String, ?>> maps) {
        final List<RawRow> rows = new ArrayList<>(maps.size());
        long n = 0;
        for (Map<String, ?> m : maps) {
            rows.add(m == null ? RawRow.malformed(++n, "row has no content") : RawRow.of(++n, m));
        }
        return new IterableSourceConnector(rows);
    }

    @Override
    public void connect() {
        cursor = rows.iterator();
    }

    @Override
    public void disconnect() {
        cursor = null;
    }

    @Override
    public PipelinePayload<RawRow> fetch() {
        if (cursor == null) throw new IllegalStateException("Source not connected");
        if (!cursor.hasNext()) return null;
        final RawRow row = cursor.next();
        return new PipelinePayload<>(row.rowId(), row);
    }
}
