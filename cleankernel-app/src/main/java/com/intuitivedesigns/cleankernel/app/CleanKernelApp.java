/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.app;

import com.intuitivedesigns.cleankernel.config.CleansingConfig;
import com.intuitivedesigns.cleankernel.config.CleansingConfigLoader;
import com.intuitivedesigns.cleankernel.config.ConfigurationException;
import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.config.PipelineFactory;
import com.intuitivedesigns.cleankernel.core.DlqSink;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.core.SourceConnector;
import com.intuitivedesigns.cleankernel.metrics.MetricsFactory;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.metrics.MetricsSettings;
import com.intuitivedesigns.cleankernel.model.RawRow;
import com.intuitivedesigns.cleankernel.pipeline.PipelineOrchestrator;
import com.intuitivedesigns.cleankernel.pipeline.RunReportWriter;
import com.intuitivedesigns.cleankernel.pipeline.RunStatus;
import com.intuitivedesigns.cleankernel.pipeline.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one cleansing job described by a properties file and exits.
 *
 * <pre>
 * java -Dck.config.path=cleankernel.properties -jar cleankernel-app.jar
 * java -jar cleankernel-app.jar cleankernel.properties
 * </pre>
 *
 * Exit status: 0 completed, 1 startup failure, 2 aborted, 3 cancelled.
 */
public final class CleanKernelApp {

    private static final Logger log = LoggerFactory.getLogger(CleanKernelApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_STARTUP_FAILURE = 1;
    public static final int EXIT_ABORTED = 2;
    public static final int EXIT_CANCELLED = 3;

    private static final String CFG_REPORT_PATH = "report.path";
    private static final String CFG_REPORT_OUTCOMES = "report.include.outcomes";
    private static final String CFG_SHUTDOWN_GRACE_MS = "shutdown.grace.ms";

    private CleanKernelApp() {}

    public static void main(String[] args) {
        final PipelineConfig config = (args.length > 0)
                ? PipelineConfig.load(Path.of(args[0]))
                : PipelineConfig.get();
        System.exit(run(config));
    }

    /**
     * Runs the job and maps the outcome to an exit status. Never calls {@link System#exit}.
     */
    public static int run(PipelineConfig config) {
        log.info("=== Booting CleanKernel ===");
        PipelineFactory.logAvailablePlugins();

        final CleansingConfig cleansing;
        try {
            cleansing = CleansingConfigLoader.load(config);
        } catch (ConfigurationException e) {
            log.error("Invalid cleansing configuration: {}", e.getMessage());
            return EXIT_STARTUP_FAILURE;
        }

        final AtomicReference<PipelineOrchestrator> running = new AtomicReference<>();
        final CountDownLatch finished = new CountDownLatch(1);
        final Duration grace = Duration.ofMillis(config.getLong(CFG_SHUTDOWN_GRACE_MS, 30_000L));
        final Thread hook = new Thread(cancelAndAwait(running, finished, grace), "ck-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try (MetricsRuntime metrics = MetricsFactory.init(MetricsSettings.from(config));
             OutputSink sink = PipelineFactory.createSink(config, metrics);
             DlqSink dlq = PipelineFactory.createDlq(config, metrics)) {

            final SourceConnector<RawRow> source = PipelineFactory.createSource(config, metrics);
            final PipelineOrchestrator pipeline = new PipelineOrchestrator(
                    cleansing, sink, dlq, metrics, PipelineOrchestrator.Settings.from(config));
            running.set(pipeline);

            final RunSummary summary = pipeline.run(source);
            writeReport(config, cleansing, summary);
            return exitCode(summary.status());
        } catch (ConfigurationException | IllegalArgumentException | IllegalStateException e) {
            log.error("Startup failed: {}", e.getMessage(), e);
            return EXIT_STARTUP_FAILURE;
        } catch (Exception e) {
            log.error("Fatal error", e);
            return EXIT_STARTUP_FAILURE;
        } finally {
            running.set(null);
            finished.countDown();
            removeHook(hook);
        }
    }

    /**
     * Shutdown hook body: cancels the run in progress, then holds the JVM until the row in flight
     * is settled and the report is written, or until {@code grace} elapses.
     */
    static Runnable cancelAndAwait(AtomicReference<PipelineOrchestrator> running,
                                   CountDownLatch finished,
                                   Duration grace) {
        return () -> {
            final PipelineOrchestrator p = running.get();
            if (p == null) return;

            log.info("Shutdown signal received. Cancelling run.");
            p.cancel();
            try {
                if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Run did not stop within {} ms; exiting without a report", grace.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for the run to stop");
            }
        };
    }

    static int exitCode(RunStatus status) {
        return switch (status) {
            case COMPLETED -> EXIT_OK;
            case ABORTED -> EXIT_ABORTED;
            case CANCELLED -> EXIT_CANCELLED;
        };
    }

    private static void writeReport(PipelineConfig config, CleansingConfig cleansing, RunSummary summary) {
        final RunReportWriter writer = new RunReportWriter(config.getBoolean(CFG_REPORT_OUTCOMES, true));
        final String path = config.getString(CFG_REPORT_PATH, null);
        if (path == null || path.isEmpty()) {
            log.info("Run report:\n{}", new RunReportWriter(false).render(summary, cleansing.version()));
            return;
        }
        writer.write(summary, cleansing.version(), Path.of(path));
        log.info("Run report written to {}", path);
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            log.debug("Shutdown in progress, hook not removed");
        }
    }
}
