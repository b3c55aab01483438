/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.extract;

import java.util.Objects;

/**
 * Either a candidate set, or a row-level structural failure.
 */
public record ExtractionResult(CandidateFieldSet fields, String malformedDetail) {

    public static ExtractionResult ok(CandidateFieldSet fields) {
        return new ExtractionResult(Objects.requireNonNull(fields, "fields"), null);
    }

    public static ExtractionResult malformed(String detail) {
        return new ExtractionResult(null, Objects.requireNonNull(detail, "detail"));
    }

    public boolean isMalformed() {
        return malformedDetail != null;
    }
}
