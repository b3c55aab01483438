/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.assemble;

import com.intuitivedesigns.cleankernel.config.CleansingConfig;
import com.intuitivedesigns.cleankernel.core.CommitOutcome;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.model.DestinationRecord;
import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.RowOutcome;
import com.intuitivedesigns.cleankernel.model.TargetField;
import com.intuitivedesigns.cleankernel.normalize.CrossFieldViolation;
import com.intuitivedesigns.cleankernel.normalize.FieldStatus;
import com.intuitivedesigns.cleankernel.normalize.NormalizedField;
import com.intuitivedesigns.cleankernel.normalize.NormalizedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns a normalized row into exactly one {@link RowOutcome}.
 *
 * <p>Per row: gate on required and identity fields, reject cross-field violations, derive the
 * identity key, then (inside the writer lane) check for a duplicate, commit with bounded retry
 * and record the key. The index is only updated after the sink confirms the commit, so a
 * failed write never makes a later row look like a duplicate.</p>
 */
public final class RecordAssembler {

    private static final Logger log = LoggerFactory.getLogger(RecordAssembler.class);

    static final String METRIC_COMMIT_LATENCY = "cleankernel.commit.latency";
    static final String METRIC_COMMIT_RETRIES = "cleankernel.commit.retries";
    static final String METRIC_DEDUP_SIZE = "cleankernel.dedup.size";

    private final CleansingConfig config;
    private final OutputSink sink;
    private final DedupIndex index;
    private final MetricsRuntime metrics;
    private final Sleeper sleeper;
    private final List<TargetField> gated;
    private final Set<TargetField> gatedSet;

    // Single writer lane: duplicate check, commit and index update form one critical section
    private final ReentrantLock writerLane = new ReentrantLock();

    public RecordAssembler(CleansingConfig config, OutputSink sink) {
        this(config, sink, new InMemoryDedupIndex(sink), MetricsRuntime.NOOP, Sleeper.SYSTEM);
    }

    public RecordAssembler(CleansingConfig config,
                           OutputSink sink,
                           DedupIndex index,
                           MetricsRuntime metrics,
                           Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.index = Objects.requireNonNull(index, "index");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.gated = config.gatedFields();
        this.gatedSet = Set.copyOf(gated);
    }

    public RowOutcome assemble(String rowId, long rowNumber, NormalizedRow row) {
        Objects.requireNonNull(rowId, "rowId");
        Objects.requireNonNull(row, "row");

        for (TargetField field : gated) {
            final NormalizedField nf = row.get(field);
            if (nf.status() == FieldStatus.ABSENT) {
                return RowOutcome.rejected(rowId, rowNumber, ReasonCode.MISSING_REQUIRED_FIELD, field,
                        "required field '" + field + "' is missing");
            }
            if (nf.status() == FieldStatus.INVALID) {
                return RowOutcome.rejected(rowId, rowNumber, nf.reason(), field,
                        "required field '" + field + "' failed validation: '" + nf.original() + "'");
            }
        }

        final Optional<CrossFieldViolation> violation = row.crossFieldViolation();
        if (violation.isPresent()) {
            final CrossFieldViolation v = violation.get();
            return RowOutcome.rejected(rowId, rowNumber, v.reason(),
                    v.fields().isEmpty() ? null : v.fields().get(0), v.detail());
        }

        final Map<TargetField, String> values = new EnumMap<>(TargetField.class);
        final List<String> warnings = new ArrayList<>();
        for (NormalizedField nf : row.fields().values()) {
            if (nf.isValid()) {
                values.put(nf.field(), nf.value());
            } else if (nf.status() == FieldStatus.INVALID && !gatedSet.contains(nf.field())) {
                warnings.add("dropped " + nf.field() + " (" + nf.reason() + "): '" + nf.original() + "'");
            }
        }

        final IdentityKey key = IdentityKey.derive(config.identityFields(), row)
                .orElseThrow(() -> new IllegalStateException("Identity fields passed gating but key is not derivable"));
        final DestinationRecord record = new DestinationRecord(rowId, key.value(), values, config.version());

        writerLane.lock();
        try {
            final Optional<String> owner;
            try {
                owner = index.lookup(key);
            } catch (Exception e) {
                log.warn("Duplicate lookup failed row={} key={}: {}", rowId, key, e.toString());
                return RowOutcome.rejected(rowId, rowNumber, ReasonCode.WRITE_FAILED, null,
                        "duplicate lookup failed: " + e.getMessage());
            }
            if (owner.isPresent()) {
                return RowOutcome.duplicate(rowId, rowNumber, owner.get());
            }

            final CommitOutcome outcome = commitWithRetry(record);
            switch (outcome.status()) {
                case COMMITTED:
                    index.record(key, rowId);
                    metrics.gauge(METRIC_DEDUP_SIZE, index.size());
                    return RowOutcome.accepted(rowId, rowNumber, outcome.destinationId(), warnings);
                case STRUCTURAL_FAILURE:
                    return RowOutcome.rejected(rowId, rowNumber, ReasonCode.DESTINATION_REJECTED, null, outcome.detail());
                default:
                    return RowOutcome.rejected(rowId, rowNumber, ReasonCode.WRITE_FAILED, null, outcome.detail());
            }
        } finally {
            writerLane.unlock();
        }
    }

    private CommitOutcome commitWithRetry(DestinationRecord record) {
        final RetryPolicy policy = config.retryPolicy();
        CommitOutcome last = CommitOutcome.transientFailure("no attempt made");

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            final long start = System.nanoTime();
            CommitOutcome outcome;
            try {
                outcome = sink.commit(record, policy.commitTimeout());
                if (outcome == null) {
                    outcome = CommitOutcome.transientFailure("sink " + sink.id() + " returned no outcome");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return CommitOutcome.transientFailure("interrupted during commit");
            } catch (Exception e) {
                log.debug("Commit threw row={} attempt={}", record.rowId(), attempt, e);
                outcome = CommitOutcome.transientFailure(e.toString());
            } finally {
                metrics.timer(METRIC_COMMIT_LATENCY, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            }

            if (outcome.status() != CommitOutcome.Status.TRANSIENT_FAILURE) {
                return outcome;
            }

            last = outcome;
            if (attempt < policy.maxAttempts()) {
                metrics.counter(METRIC_COMMIT_RETRIES);
                log.warn("Transient commit failure row={} attempt={}/{}: {}",
                        record.rowId(), attempt, policy.maxAttempts(), outcome.detail());
                try {
                    sleeper.sleep(policy.backoffFor(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return CommitOutcome.transientFailure("interrupted during retry backoff: " + outcome.detail());
                }
            }
        }

        log.error("Commit failed after {} attempts row={}: {}", policy.maxAttempts(), record.rowId(), last.detail());
        return CommitOutcome.transientFailure("gave up after " + policy.maxAttempts() + " attempts: " + last.detail());
    }
}
