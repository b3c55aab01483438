/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.pipeline;

import com.intuitivedesigns.cleankernel.assemble.InMemoryDedupIndex;
import com.intuitivedesigns.cleankernel.assemble.RecordAssembler;
import com.intuitivedesigns.cleankernel.assemble.Sleeper;
import com.intuitivedesigns.cleankernel.config.CleansingConfig;
import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.DlqSink;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.core.PipelinePayload;
import com.intuitivedesigns.cleankernel.core.SourceConnector;
import com.intuitivedesigns.cleankernel.extract.ExtractionResult;
import com.intuitivedesigns.cleankernel.extract.FieldExtractor;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.model.ReasonCode;
import com.intuitivedesigns.cleankernel.model.RowOutcome;
import com.intuitivedesigns.cleankernel.normalize.NormalizationEngine;
import com.intuitivedesigns.cleankernel.normalize.NormalizedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives rows from a source through extraction, normalization and assembly, one outcome per row.
 *
 * <p>Extraction and normalization are pure and may run on a fixed pool; assembly always runs on
 * the calling thread in input order, so first-write-wins is decided by input position and two
 * runs over the same input produce the same summary.</p>
 */
public final class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String METRIC_ROWS_TOTAL = "cleankernel.rows.total";
    static final String METRIC_ROWS_ACCEPTED = "cleankernel.rows.accepted";
    static final String METRIC_ROWS_DUPLICATE = "cleankernel.rows.duplicate";
    static final String METRIC_ROWS_REJECTED = "cleankernel.rows.rejected";
    static final String METRIC_DLQ_WRITES = "cleankernel.dlq.writes";
    static final String METRIC_DLQ_FAILURES = "cleankernel.dlq.failures";
    static final String METRIC_SOURCE_ERRORS = "cleankernel.source.errors";

    /**
     * Run-level tuning.
     *
     * @param parallelism threads for extraction and normalization; 1 runs everything inline
     * @param batchSize rows fetched from the source per call
     * @param abortAfterConsecutiveWriteFailures abort once this many rows in a row end in
     *                                           WRITE_FAILED; 0 disables the check
     * @param failFastOnSourceError abort on the first source error instead of retrying
     * @param sourceMaxRetries consecutive source errors tolerated before aborting
     * @param sourceErrorBackoffInitialMs first wait after a source error
     * @param sourceErrorBackoffMaxMs cap for the doubling wait
     */
    public record Settings(int parallelism,
                           int batchSize,
                           int abortAfterConsecutiveWriteFailures,
                           boolean failFastOnSourceError,
                           int sourceMaxRetries,
                           long sourceErrorBackoffInitialMs,
                           long sourceErrorBackoffMaxMs) {

        public static final String KEY_PARALLELISM = "pipeline.parallelism";
        public static final String KEY_BATCH_SIZE = "pipeline.batch.size";
        public static final String KEY_ABORT_AFTER = "pipeline.abort.after.consecutive.write.failures";
        public static final String KEY_SOURCE_FAIL_FAST = "pipeline.source.fail.fast";
        public static final String KEY_SOURCE_MAX_RETRIES = "pipeline.source.max.retries";
        public static final String KEY_SOURCE_BACKOFF_INITIAL = "pipeline.source.backoff.initial.ms";
        public static final String KEY_SOURCE_BACKOFF_MAX = "pipeline.source.backoff.max.ms";

        public Settings {
            if (parallelism <= 0) throw new IllegalArgumentException("Parallelism must be > 0");
            if (batchSize <= 0) throw new IllegalArgumentException("BatchSize must be > 0");
            if (abortAfterConsecutiveWriteFailures < 0) {
                throw new IllegalArgumentException("abortAfterConsecutiveWriteFailures must be >= 0");
            }
            sourceMaxRetries = Math.max(0, sourceMaxRetries);
            sourceErrorBackoffInitialMs = Math.max(0L, sourceErrorBackoffInitialMs);
            sourceErrorBackoffMaxMs = Math.max(sourceErrorBackoffInitialMs, sourceErrorBackoffMaxMs);
        }

        public static Settings defaults() {
            return new Settings(1, 500, 3, false, 5, 100, 5_000);
        }

        public static Settings from(PipelineConfig config) {
            final Settings d = defaults();
            return new Settings(
                    config.getInt(KEY_PARALLELISM, d.parallelism()),
                    config.getInt(KEY_BATCH_SIZE, d.batchSize()),
                    config.getInt(KEY_ABORT_AFTER, d.abortAfterConsecutiveWriteFailures()),
                    config.getBoolean(KEY_SOURCE_FAIL_FAST, d.failFastOnSourceError()),
                    config.getInt(KEY_SOURCE_MAX_RETRIES, d.sourceMaxRetries()),
                    config.getLong(KEY_SOURCE_BACKOFF_INITIAL, d.sourceErrorBackoffInitialMs()),
                    config.getLong(KEY_SOURCE_BACKOFF_MAX, d.sourceErrorBackoffMaxMs()));
        }
    }

    private final FieldExtractor extractor;
    private final NormalizationEngine engine;
    private final RecordAssembler assembler;
    private final OutputSink sink;
    private final DlqSink dlqSink;
    private final MetricsRuntime metrics;
    private final Settings settings;
    private final Sleeper sleeper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public PipelineOrchestrator(CleansingConfig config,
                                OutputSink sink,
                                DlqSink dlqSink,
                                MetricsRuntime metrics,
                                Settings settings) {
        this(config, sink, dlqSink, metrics, settings, Sleeper.SYSTEM);
    }

    public PipelineOrchestrator(CleansingConfig config,
                                OutputSink sink,
                                DlqSink dlqSink,
                                MetricsRuntime metrics,
                                Settings settings,
                                Sleeper sleeper) {
        Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.dlqSink = dlqSink;
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");

        this.extractor = new FieldExtractor(config.mapping());
        this.engine = new NormalizationEngine(config.rules());
        this.assembler = new RecordAssembler(config, sink, new InMemoryDedupIndex(sink), this.metrics, sleeper);
    }

    /**
     * Requests a stop. The row in flight finishes; remaining rows get no outcome and the
     * summary reports {@link RunStatus#CANCELLED}.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public RunSummary run(SourceConnector<RawRow> source) {
        Objects.requireNonNull(source, "source");
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline is already running");
        }
        cancelRequested.set(false);

        final RunSummary.Builder summary = RunSummary.builder();
        ExecutorService pool = null;

        log.info("Pipeline starting: parallelism={} batchSize={} sink={}",
                settings.parallelism(), settings.batchSize(), sink.id());
        try {
            source.connect();
            if (settings.parallelism() > 1) {
                pool = Executors.newFixedThreadPool(settings.parallelism(), workerThreads());
            }
            process(source, pool, summary);
        } finally {
            shutdown(pool);
            safeFlush();
            safeDisconnect(source);
            running.set(false);
        }

        final RunSummary result = summary.build();
        log.info("Pipeline finished: status={} total={} accepted={} duplicates={} rejected={} byReason={}",
                result.status(), result.total(), result.accepted(), result.duplicates(),
                result.rejected(), result.rejectedByReason());
        if (result.abortCause() != null) {
            log.error("Run aborted: {}", result.abortCause());
        }
        return result;
    }

    private void process(SourceConnector<RawRow> source, ExecutorService pool, RunSummary.Builder summary) {
        long sequence = 0;
        int consecutiveWriteFailures = 0;
        int consecutiveSourceErrors = 0;
        long backoffMs = settings.sourceErrorBackoffInitialMs();

        while (true) {
            if (isCancelled()) {
                summary.cancel();
                return;
            }

            final List<PipelinePayload<RawRow>> batch;
            try {
                batch = source.fetchBatch(settings.batchSize());
                consecutiveSourceErrors = 0;
                backoffMs = settings.sourceErrorBackoffInitialMs();
            } catch (RuntimeException e) {
                metrics.counter(METRIC_SOURCE_ERRORS);
                consecutiveSourceErrors++;
                if (settings.failFastOnSourceError() || consecutiveSourceErrors > settings.sourceMaxRetries()) {
                    log.error("Source fetch failed (giving up after {} attempts)", consecutiveSourceErrors, e);
                    summary.abort("source fetch failed: " + e.getMessage());
                    return;
                }
                log.error("Source fetch failed (retrying in {}ms)", backoffMs, e);
                try {
                    sleeper.sleep(Duration.ofMillis(backoffMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    summary.cancel();
                    return;
                }
                backoffMs = Math.min(backoffMs * 2, settings.sourceErrorBackoffMaxMs());
                continue;
            }

            if (batch == null || batch.isEmpty()) {
                return;
            }

            final List<Prepared> prepared = new ArrayList<>(batch.size());
            for (PipelinePayload<RawRow> payload : batch) {
                prepared.add(new Prepared(payload, ++sequence));
            }
            prepare(prepared, pool);

            for (Prepared p : prepared) {
                if (isCancelled()) {
                    summary.cancel();
                    return;
                }

                final RowOutcome outcome = finish(p);
                summary.record(outcome);
                count(outcome);
                if (outcome.isRejected()) {
                    deadLetter(outcome, p.row);
                }

                if (ReasonCode.WRITE_FAILED.equals(outcome.reason())) {
                    consecutiveWriteFailures++;
                } else {
                    consecutiveWriteFailures = 0;
                }
                final int limit = settings.abortAfterConsecutiveWriteFailures();
                if (limit > 0 && consecutiveWriteFailures >= limit) {
                    summary.abort("destination unreachable: " + consecutiveWriteFailures
                            + " consecutive write failures, last: " + outcome.detail());
                    return;
                }
            }
        }
    }

    // Extraction and normalization only; never touches the sink
    private void prepare(List<Prepared> rows, ExecutorService pool) {
        if (pool == null) {
            rows.forEach(this::prepareOne);
            return;
        }

        final List<Future<?>> futures = new ArrayList<>(rows.size());
        for (Prepared p : rows) {
            futures.add(pool.submit(() -> prepareOne(p)));
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                return;
            } catch (ExecutionException ee) {
                rows.get(i).fail(ee.getCause());
            }
        }
    }

    private void prepareOne(Prepared p) {
        try {
            final ExtractionResult extracted = extractor.extract(p.row);
            if (extracted.isMalformed()) {
                p.early = RowOutcome.rejected(p.rowId, p.rowNumber, ReasonCode.MALFORMED_ROW, null,
                        extracted.malformedDetail());
                return;
            }
            p.normalized = engine.normalize(extracted.fields());
        } catch (Exception e) {
            p.fail(e);
        }
    }

    private RowOutcome finish(Prepared p) {
        if (p.early != null) return p.early;
        if (p.normalized == null) {
            // Preparation never ran, e.g. the worker was interrupted
            return RowOutcome.rejected(p.rowId, p.rowNumber, ReasonCode.INTERNAL_ERROR, null, "row was not prepared");
        }
        try {
            return assembler.assemble(p.rowId, p.rowNumber, p.normalized);
        } catch (Exception e) {
            log.error("Row failed unexpectedly id={}", p.rowId, e);
            return RowOutcome.rejected(p.rowId, p.rowNumber, ReasonCode.INTERNAL_ERROR, null, String.valueOf(e));
        }
    }

    private void count(RowOutcome outcome) {
        metrics.counter(METRIC_ROWS_TOTAL);
        switch (outcome.status()) {
            case ACCEPTED -> metrics.counter(METRIC_ROWS_ACCEPTED);
            case DUPLICATE -> metrics.counter(METRIC_ROWS_DUPLICATE);
            case REJECTED -> metrics.counter(METRIC_ROWS_REJECTED, "reason", outcome.reason().name());
        }
    }

    private void deadLetter(RowOutcome outcome, RawRow row) {
        if (dlqSink == null) return;
        try {
            dlqSink.write(outcome, row);
            metrics.counter(METRIC_DLQ_WRITES);
        } catch (Exception e) {
            metrics.counter(METRIC_DLQ_FAILURES);
            log.error("DOUBLE FAULT: DLQ write failed id={}", outcome.rowId(), e);
        }
    }

    private boolean isCancelled() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }

    private void shutdown(ExecutorService pool) {
        if (pool == null) return;
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private void safeFlush() {
        try {
            sink.flush();
        } catch (Exception e) {
            log.warn("Error flushing sink {}", sink.id(), e);
        }
        if (dlqSink != null) {
            try {
                dlqSink.flush();
            } catch (Exception e) {
                log.warn("Error flushing DLQ sink", e);
            }
        }
    }

    private static void safeDisconnect(SourceConnector<?> source) {
        try {
            source.disconnect();
        } catch (Exception e) {
            log.warn("Error disconnecting source", e);
        }
    }

    private static ThreadFactory workerThreads() {
        final AtomicInteger n = new AtomicInteger();
        return r -> {
            final Thread t = new Thread(r, "cleankernel-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Per-row state carried from the worker pool back to the writer lane. */
    private static final class Prepared {
        final RawRow row;
        final String rowId;
        final long rowNumber;
        volatile NormalizedRow normalized;
        volatile RowOutcome early;

        Prepared(PipelinePayload<RawRow> payload, long sequence) {
            this.row = payload.data();
            this.rowId = (row != null) ? row.rowId() : payload.id();
            this.rowNumber = (row != null) ? row.rowNumber() : sequence;
        }

        void fail(Throwable t) {
            log.error("Row failed during preparation id={}", rowId, t);
            this.early = RowOutcome.rejected(rowId, rowNumber, ReasonCode.INTERNAL_ERROR, null, String.valueOf(t));
        }
    }
}
