/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.cleankernel.config.CleansingConfigLoader;
import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.config.PipelineFactory;
import com.intuitivedesigns.cleankernel.core.CommitOutcome;
import com.intuitivedesigns.cleankernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.cleankernel.model.DestinationRecord;
import com.intuitivedesigns.cleankernel.output.InMemoryOutputSink;
import com.intuitivedesigns.cleankernel.pipeline.PipelineOrchestrator;
import com.intuitivedesigns.cleankernel.pipeline.RunStatus;
import com.intuitivedesigns.cleankernel.pipeline.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CleanKernelAppTest {

    private final ObjectMapper json = new ObjectMapper();

    @TempDir
    Path dir;

    private Properties props;

    @BeforeEach
    void setUp() throws Exception {
        Path csv = dir.resolve("legacy_signups.csv");
        try (InputStream in = getClass().getResourceAsStream("/legacy_signups.csv")) {
            Files.copy(in, csv, StandardCopyOption.REPLACE_EXISTING);
        }

        props = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/cleankernel.properties")) {
            props.load(in);
        }
        props.setProperty("source.csv.path", csv.toString());
        props.setProperty("dlq.jsonl.path", dir.resolve("dead-letters.jsonl").toString());
        props.setProperty("report.path", dir.resolve("run-report.json").toString());
        props.setProperty("metrics.log.summary", "false");
    }

    private int run() {
        return CleanKernelApp.run(PipelineConfig.fromProperties(props));
    }

    @Test
    void testLegacyExportEndToEnd() throws Exception {
        // Act
        int exit = run();

        // Assert
        assertEquals(CleanKernelApp.EXIT_OK, exit);

        JsonNode report = json.readTree(dir.resolve("run-report.json").toFile());
        assertEquals("COMPLETED", report.get("status").asText());
        assertEquals("2024.1", report.get("configVersion").asText());
        assertEquals(10, report.get("total").asLong());
        assertEquals(5, report.get("accepted").asLong());
        assertEquals(1, report.get("duplicates").asLong());
        assertEquals(4, report.get("rejected").asLong());

        JsonNode byReason = report.get("rejectedByReason");
        assertEquals(1, byReason.get("MALFORMED_DATE").asLong());
        assertEquals(1, byReason.get("MISSING_REQUIRED_FIELD").asLong());
        assertEquals(1, byReason.get("DATE_RANGE_INVERTED").asLong());
        assertEquals(1, byReason.get("MALFORMED_ROW").asLong());

        JsonNode outcomes = report.get("outcomes");
        assertEquals(10, outcomes.size());
        assertEquals("row-3", outcomes.get(2).get("rowId").asText());
        assertEquals("MALFORMED_DATE", outcomes.get(2).get("reason").asText());
        assertEquals("DUPLICATE", outcomes.get(6).get("status").asText());
        assertEquals("row-1", outcomes.get(6).get("duplicateOf").asText());

        List<String> deadLetters = Files.readAllLines(dir.resolve("dead-letters.jsonl"));
        assertEquals(4, deadLetters.size());
        assertEquals("row-3", json.readTree(deadLetters.get(0)).get("rowId").asText());
    }

    @Test
    void testRerunAgainstDatabaseIsIdempotent() throws Exception {
        String url = "jdbc:h2:mem:app_rerun;DB_CLOSE_DELAY=-1";
        props.setProperty("sink.type", "JDBC");
        props.setProperty("sink.jdbc.url", url);
        props.setProperty("sink.jdbc.create.table", "true");

        assertEquals(CleanKernelApp.EXIT_OK, run());
        assertEquals(CleanKernelApp.EXIT_OK, run());

        JsonNode second = json.readTree(dir.resolve("run-report.json").toFile());
        assertEquals(0, second.get("accepted").asLong());
        assertEquals(6, second.get("duplicates").asLong());

        try (Connection c = DriverManager.getConnection(url);
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM cleansed_records")) {
            assertTrue(rs.next());
            assertEquals(5, rs.getInt(1));
            s.execute("SHUTDOWN");
        }
    }

    @Test
    void testInvalidCleansingConfigurationFailsStartup() {
        props.setProperty("identity.fields", "full_name, nickname");

        assertEquals(CleanKernelApp.EXIT_STARTUP_FAILURE, run());
        assertFalse(Files.exists(dir.resolve("run-report.json")));
    }

    @Test
    void testUnknownSourceFailsStartup() {
        props.setProperty("source.type", "KAFKA");

        assertEquals(CleanKernelApp.EXIT_STARTUP_FAILURE, run());
    }

    @Test
    void testMissingInputFailsStartup() {
        props.setProperty("source.csv.path", dir.resolve("missing.csv").toString());

        assertEquals(CleanKernelApp.EXIT_STARTUP_FAILURE, run());
    }

    @Test
    void testExitCodes() {
        assertEquals(0, CleanKernelApp.exitCode(RunStatus.COMPLETED));
        assertEquals(2, CleanKernelApp.exitCode(RunStatus.ABORTED));
        assertEquals(3, CleanKernelApp.exitCode(RunStatus.CANCELLED));
    }

    @Test
    void testShutdownHookWaitsForRowInFlight() throws Exception {
        // Setup
        PipelineConfig config = PipelineConfig.fromProperties(props);
        BlockingSink sink = new BlockingSink();
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        PipelineOrchestrator pipeline = new PipelineOrchestrator(CleansingConfigLoader.load(config), sink, null,
                metrics, PipelineOrchestrator.Settings.defaults());

        AtomicReference<PipelineOrchestrator> running = new AtomicReference<>(pipeline);
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<RunSummary> summary = new AtomicReference<>();
        Thread runner = new Thread(() -> {
            try {
                summary.set(pipeline.run(PipelineFactory.createSource(config, metrics)));
            } finally {
                finished.countDown();
            }
        });
        runner.start();
        assertTrue(sink.entered.await(5, TimeUnit.SECONDS));

        // Act
        Thread hook = new Thread(CleanKernelApp.cancelAndAwait(running, finished, Duration.ofSeconds(10)));
        hook.start();
        hook.join(200);
        boolean heldWhileCommitting = hook.isAlive();
        sink.release.countDown();
        hook.join(5000);

        // Assert
        assertTrue(heldWhileCommitting);
        assertFalse(hook.isAlive());
        assertEquals(RunStatus.CANCELLED, summary.get().status());
        assertEquals(1, summary.get().accepted());
        assertEquals(1, sink.size());
    }

    @Test
    void testShutdownHookGivesUpAfterGrace() {
        CountDownLatch neverFinished = new CountDownLatch(1);
        PipelineOrchestrator idle = new PipelineOrchestrator(CleansingConfigLoader.load(PipelineConfig.fromProperties(props)),
                new InMemoryOutputSink(), null, new MicrometerMetricsRuntime(), PipelineOrchestrator.Settings.defaults());

        long start = System.nanoTime();
        CleanKernelApp.cancelAndAwait(new AtomicReference<>(idle), neverFinished, Duration.ofMillis(50)).run();

        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
        CleanKernelApp.cancelAndAwait(new AtomicReference<>(), neverFinished, Duration.ofSeconds(10)).run();
    }

    private static final class BlockingSink extends InMemoryOutputSink {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public CommitOutcome commit(DestinationRecord record, Duration timeout) {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return super.commit(record, timeout);
        }
    }
}
