/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.core;

import java.util.Objects;

/**
 * Result of a single {@link OutputSink#commit} call.
 *
 * @param status what happened
 * @param destinationId the store's identifier for the committed record (only on success)
 * @param detail human readable cause for failures
 */
public record CommitOutcome(Status status, String destinationId, String detail) {

    public enum Status {
        COMMITTED,
        /** The store could not be reached or timed out. Safe to retry. */
        TRANSIENT_FAILURE,
        /** The store refused the record (schema, constraint). Retrying cannot help. */
        STRUCTURAL_FAILURE
    }

    public CommitOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static CommitOutcome committed(String destinationId) {
        return new CommitOutcome(Status.COMMITTED, destinationId, null);
    }

    public static CommitOutcome transientFailure(String detail) {
        return new CommitOutcome(Status.TRANSIENT_FAILURE, null, detail);
    }

    public static CommitOutcome structuralFailure(String detail) {
        return new CommitOutcome(Status.STRUCTURAL_FAILURE, null, detail);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }
}
