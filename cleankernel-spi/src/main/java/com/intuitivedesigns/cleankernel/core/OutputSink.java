/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.core;

import com.intuitivedesigns.cleankernel.model.DestinationRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * The destination store for finalized records.
 *
 * Examples:
 * - JDBC table
 * - In-memory store (tests, dry runs)
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #commit(DestinationRecord, Duration)} is atomic: every field of the record is
 * stored, or nothing is.</li>
 * <li>Failures are reported through the returned {@link CommitOutcome}. Throwing is reserved
 * for unexpected conditions and is treated by the pipeline as a transient failure.</li>
 * <li>The timeout must be honoured; a write that cannot finish in time is rolled back and
 * reported as {@link CommitOutcome.Status#TRANSIENT_FAILURE}.</li>
 * </ul>
 *
 * The pipeline serializes calls to {@link #commit}, so implementations need not be
 * thread-safe for commits, but {@link #findCommitted} may be called from the writer lane only.
 */
public interface OutputSink extends AutoCloseable {

    /**
     * Store the record as a single atomic operation.
     *
     * @param record the finalized record
     * @param timeout upper bound for this write
     * @return the outcome of the write
     * @throws Exception on unexpected failures (retried as transient)
     */
    CommitOutcome commit(DestinationRecord record, Duration timeout) throws Exception;

    /**
     * Looks up a record committed by an earlier run.
     *
     * @param identityKey the identity key of a record
     * @return the row id stored with that key, if any
     * @throws Exception if the lookup cannot be performed
     */
    default Optional<String> findCommitted(String identityKey) throws Exception {
        return Optional.empty();
    }

    default void flush() throws Exception {
        // no-op by default for non-batching sinks
    }

    /**
     * Returns a unique identifier for this sink instance.
     * Useful for logging and metrics tagging (e.g., "jdbc-customers").
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
