/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.model;

import java.util.List;
import java.util.Objects;

/**
 * Terminal state of one input row.
 *
 * @param rowId input row id
 * @param rowNumber 1-based position in the input
 * @param status accepted, rejected or duplicate
 * @param reason rejection reason; {@code null} unless rejected
 * @param field the field that caused a rejection, if one did
 * @param detail short description for operators
 * @param duplicateOf row id of the record that won first-write-wins
 * @param destinationId identifier assigned by the store on commit
 * @param warnings non-fatal notes, such as optional fields dropped as invalid
 */
public record RowOutcome(
        String rowId,
        long rowNumber,
        Status status,
        ReasonCode reason,
        TargetField field,
        String detail,
        String duplicateOf,
        String destinationId,
        List<String> warnings
) {

    public enum Status {
        ACCEPTED,
        REJECTED,
        DUPLICATE
    }

    public RowOutcome {
        Objects.requireNonNull(rowId, "rowId");
        Objects.requireNonNull(status, "status");
        if (status == Status.REJECTED && reason == null) {
            throw new IllegalArgumentException("Rejected outcome requires a reason code");
        }
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }

    public static RowOutcome accepted(String rowId, long rowNumber, String destinationId, List<String> warnings) {
        return new RowOutcome(rowId, rowNumber, Status.ACCEPTED, null, null, null, null, destinationId, warnings);
    }

    public static RowOutcome rejected(String rowId, long rowNumber, ReasonCode reason, TargetField field, String detail) {
        return new RowOutcome(rowId, rowNumber, Status.REJECTED, reason, field, detail, null, null, List.of());
    }

    public static RowOutcome duplicate(String rowId, long rowNumber, String duplicateOf) {
        return new RowOutcome(rowId, rowNumber, Status.DUPLICATE, null, null,
                "identity key already committed by " + duplicateOf, duplicateOf, null, List.of());
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
