/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.pipeline;

import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.RowOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Frozen report of one run. Holds no timestamps, so two runs over the same input and
 * configuration produce equal summaries.
 *
 * @param total rows that received an outcome
 * @param accepted rows committed to the destination
 * @param duplicates rows whose identity key was already committed
 * @param rejected rows rejected for any reason
 * @param rejectedByReason rejection counts keyed by reason code, sorted by code
 * @param outcomes every outcome in input order
 * @param status how the run ended
 * @param abortCause why the run was aborted; {@code null} otherwise
 */
public record RunSummary(
        long total,
        long accepted,
        long duplicates,
        long rejected,
        SortedMap<ReasonCode, Long> rejectedByReason,
        List<RowOutcome> outcomes,
        RunStatus status,
        String abortCause
) {

    public RunSummary {
        Objects.requireNonNull(status, "status");
        rejectedByReason = Collections.unmodifiableSortedMap(new TreeMap<>(rejectedByReason));
        outcomes = List.copyOf(outcomes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public long rejected(ReasonCode reason) {
        return rejectedByReason.getOrDefault(reason, 0L);
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    /**
     * Accumulates outcomes while the run is in progress. Not thread-safe; owned by the
     * orchestrator thread.
     */
    public static final class Builder {
        private long accepted;
        private long duplicates;
        private long rejected;
        private final Map<ReasonCode, Long> byReason = new TreeMap<>();
        private final List<RowOutcome> outcomes = new ArrayList<>();
        private RunStatus status = RunStatus.COMPLETED;
        private String abortCause;

        private Builder() {}

        public Builder record(RowOutcome outcome) {
            Objects.requireNonNull(outcome, "outcome");
            outcomes.add(outcome);
            switch (outcome.status()) {
                case ACCEPTED -> accepted++;
                case DUPLICATE -> duplicates++;
                case REJECTED -> {
                    rejected++;
                    byReason.merge(outcome.reason(), 1L, Long::sum);
                }
            }
            return this;
        }

        public Builder abort(String cause) {
            this.status = RunStatus.ABORTED;
            this.abortCause = Objects.requireNonNull(cause, "cause");
            return this;
        }

        public Builder cancel() {
            if (status == RunStatus.COMPLETED) {
                this.status = RunStatus.CANCELLED;
            }
            return this;
        }

        public long total() {
            return outcomes.size();
        }

        public RunSummary build() {
            return new RunSummary(outcomes.size(), accepted, duplicates, rejected,
                    new TreeMap<>(byReason), outcomes, status, abortCause);
        }
    }
}
