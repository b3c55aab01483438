/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.output;

import com.intuitivedesigns.cleankernel.core.CommitOutcome;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.model.DestinationRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Destination held in memory, keyed by identity key. Used for dry runs and tests.
 *
 * <p>Enforces the same uniqueness a database table would: a second record with a committed
 * identity key is refused as a structural failure.</p>
 */
public class InMemoryOutputSink implements OutputSink {

    public static final String ID = "MEMORY";

    private final Map<String, DestinationRecord> byKey = new LinkedHashMap<>();
    private final String id;
    private long sequence;

    public InMemoryOutputSink() {
        this("memory");
    }

    public InMemoryOutputSink(String id) {
        this.id = id;
    }

    @Override
    public synchronized CommitOutcome commit(DestinationRecord record, Duration timeout) {
        if (byKey.containsKey(record.identityKey())) {
            return CommitOutcome.structuralFailure("identity key already stored: " + record.identityKey());
        }
        byKey.put(record.identityKey(), record);
        return CommitOutcome.committed(id + "-" + (++sequence));
    }

    @Override
    public synchronized Optional<String> findCommitted(String identityKey) {
        final DestinationRecord r = byKey.get(identityKey);
        return (r == null) ? Optional.empty() : Optional.of(r.rowId());
    }

    /** Seeds records as if an earlier run had committed them. */
    public synchronized void preload(List<DestinationRecord> records) {
        for (DestinationRecord r : records) {
            byKey.putIfAbsent(r.identityKey(), r);
        }
    }

    /** Committed records in commit order. */
    public synchronized List<DestinationRecord> records() {
        return Collections.unmodifiableList(new ArrayList<>(byKey.values()));
    }

    public synchronized int size() {
        return byKey.size();
    }

    @Override
    public String id() {
        return id;
    }
}
