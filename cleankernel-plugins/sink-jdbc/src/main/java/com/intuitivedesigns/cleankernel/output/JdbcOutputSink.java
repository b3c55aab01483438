/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.output;

import com.intuitivedesigns.cleankernel.config.PipelineConfig;
import com.intuitivedesigns.cleankernel.core.CommitOutcome;
import com.intuitivedesigns.cleankernel.core.OutputSink;
import com.intuitivedesigns.cleankernel.metrics.MetricsRuntime;
import com.intuitivedesigns.cleankernel.model.DestinationRecord;
import com.intuitivedesigns.cleankernel.model.TargetField;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Relational destination. Each record is one {@code INSERT} in its own transaction, bounded by
 * a query timeout.
 *
 * <p>The table has one column per {@link TargetField} (named by wire name) plus
 * {@code row_id}, {@code identity_key} (unique) and {@code config_version}. A unique-key or
 * data violation is a structural failure; connection loss, timeouts and deadlocks are
 * transient.</p>
 */
public final class JdbcOutputSink implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcOutputSink.class);

    public static final String DEFAULT_TABLE = "cleansed_records";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final int DEFAULT_POOL_SIZE = 2;
    private static final long DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    private static final int VALUE_LENGTH = 4000;

    // SQLState classes that describe the data, not the connection
    private static final Set<String> STRUCTURAL_STATE_CLASSES = Set.of("22", "23", "42", "44");

    private final HikariDataSource dataSource;
    private final String table;
    private final String insertSql;
    private final String lookupSql;
    private final MetricsRuntime metrics;

    public JdbcOutputSink(HikariDataSource dataSource, String table, boolean createTable, MetricsRuntime metrics) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.table = validateTable(table);
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;
        this.insertSql = buildInsert(this.table);
        this.lookupSql = "SELECT row_id FROM " + this.table + " WHERE identity_key = ?";

        if (createTable) {
            createTable();
        }
        log.info("JdbcOutputSink Active. table={} pool={}", this.table, dataSource.getPoolName());
    }

    public static JdbcOutputSink fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final String url = config.getString("sink.jdbc.url", null);
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("Missing required configuration key: sink.jdbc.url");
        }

        final HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(url);
        hikari.setUsername(config.getString("sink.jdbc.username", null));
        hikari.setPassword(config.getString("sink.jdbc.password", null));
        hikari.setMaximumPoolSize(config.getInt("sink.jdbc.pool.size", DEFAULT_POOL_SIZE));
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(config.getLong("sink.jdbc.connect.timeout.ms", DEFAULT_CONNECT_TIMEOUT_MS));
        hikari.setAutoCommit(false); // one transaction per record, committed explicitly
        hikari.setPoolName("cleankernel-jdbc");

        final HikariDataSource dataSource = new HikariDataSource(hikari);
        try {
            return new JdbcOutputSink(dataSource,
                    config.getString("sink.jdbc.table", DEFAULT_TABLE),
                    config.getBoolean("sink.jdbc.create.table", false),
                    metrics);
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    @Override
    public CommitOutcome commit(DestinationRecord record, Duration timeout) {
        final long start = System.nanoTime();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                stmt.setQueryTimeout(timeoutSeconds(timeout));
                int i = 1;
                stmt.setString(i++, record.rowId());
                stmt.setString(i++, record.identityKey());
                stmt.setString(i++, record.configVersion());
                for (TargetField f : TargetField.values()) {
                    stmt.setString(i++, record.value(f));
                }
                stmt.executeUpdate();
                conn.commit();

                metrics.counter("sink.jdbc.written");
                metrics.timer("sink.jdbc.latency", (System.nanoTime() - start) / 1_000_000);
                return CommitOutcome.committed(table + "/" + record.rowId());
            } catch (SQLException e) {
                rollback(conn, record.rowId());
                metrics.counter("sink.jdbc.errors");
                return classify(e);
            }
        } catch (SQLException e) {
            metrics.counter("sink.jdbc.errors");
            return CommitOutcome.transientFailure("no connection: " + e.getMessage());
        }
    }

    @Override
    public Optional<String> findCommitted(String identityKey) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(lookupSql)) {
            stmt.setString(1, identityKey);
            try (ResultSet rs = stmt.executeQuery()) {
                final Optional<String> owner = rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
                conn.rollback();
                return owner;
            }
        }
    }

    @Override
    public String id() {
        return "jdbc-" + table;
    }

    @Override
    public void close() {
        dataSource.close();
        log.info("JdbcOutputSink Closed.");
    }

    static CommitOutcome classify(SQLException e) {
        final String detail = e.getClass().getSimpleName() + ": " + e.getMessage();
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return CommitOutcome.structuralFailure(detail);
        }
        if (e instanceof SQLTransientException
                || e instanceof SQLRecoverableException
                || e instanceof SQLNonTransientConnectionException) {
            return CommitOutcome.transientFailure(detail);
        }
        final String state = e.getSQLState();
        if (state != null && state.length() >= 2 && STRUCTURAL_STATE_CLASSES.contains(state.substring(0, 2))) {
            return CommitOutcome.structuralFailure(detail);
        }
        return CommitOutcome.transientFailure(detail);
    }

    private void createTable() {
        final StringJoiner cols = new StringJoiner(", ", "CREATE TABLE IF NOT EXISTS " + table + " (", ")");
        cols.add("row_id VARCHAR(64) NOT NULL");
        cols.add("identity_key VARCHAR(" + VALUE_LENGTH + ") NOT NULL UNIQUE");
        cols.add("config_version VARCHAR(64) NOT NULL");
        for (TargetField f : TargetField.values()) {
            cols.add(f.wireName() + " VARCHAR(" + VALUE_LENGTH + ")");
        }
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(cols.toString());
            conn.commit();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot create table " + table, e);
        }
    }

    private static String buildInsert(String table) {
        final StringJoiner names = new StringJoiner(", ", "(", ")");
        final StringJoiner marks = new StringJoiner(", ", "(", ")");
        for (String c : new String[]{"row_id", "identity_key", "config_version"}) {
            names.add(c);
            marks.add("?");
        }
        for (TargetField f : TargetField.values()) {
            names.add(f.wireName());
            marks.add("?");
        }
        return "INSERT INTO " + table + " " + names + " VALUES " + marks;
    }

    private static String validateTable(String table) {
        if (table == null || !TABLE_NAME.matcher(table.trim()).matches()) {
            throw new IllegalArgumentException("Invalid table name: '" + table + "'");
        }
        return table.trim();
    }

    private static int timeoutSeconds(Duration timeout) {
        if (timeout == null) return 0;
        final long ms = timeout.toMillis();
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, (ms + 999) / 1000));
    }

    private static void rollback(Connection conn, String rowId) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed row={}: {}", rowId, e.getMessage());
        }
    }
}
