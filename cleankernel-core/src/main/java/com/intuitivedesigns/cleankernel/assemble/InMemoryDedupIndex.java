/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.assemble;

import com.intuitivedesigns.cleankernel.core.OutputSink;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run index. A miss falls back to {@link OutputSink#findCommitted(String)} so records
 * written by an earlier run are seen as duplicates, and the answer is cached.
 */
public final class InMemoryDedupIndex implements DedupIndex {

    private final Map<String, String> owners = new HashMap<>();
    private final OutputSink fallback;

    public InMemoryDedupIndex() {
        this(null);
    }

    public InMemoryDedupIndex(OutputSink fallback) {
        this.fallback = fallback;
    }

    @Override
    public Optional<String> lookup(IdentityKey key) throws Exception {
        final String owner = owners.get(key.value());
        if (owner != null) return Optional.of(owner);
        if (fallback == null) return Optional.empty();

        final Optional<String> committed = fallback.findCommitted(key.value());
        committed.ifPresent(rowId -> owners.put(key.value(), rowId));
        return committed;
    }

    @Override
    public void record(IdentityKey key, String rowId) {
        owners.putIfAbsent(key.value(), rowId);
    }

    @Override
    public int size() {
        return owners.size();
    }
}
