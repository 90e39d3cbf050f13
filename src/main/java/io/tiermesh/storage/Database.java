package io.tiermesh.storage;

import io.tiermesh.config.TierMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final TierMeshConfig config;
    private final String jdbcUrl;

    public Database(TierMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
            st.execute("PRAGMA foreign_keys=ON");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.tiersRoot());
            Files.createDirectories(config.securityRoot());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS records (
                        record_id TEXT PRIMARY KEY,
                        tier_id TEXT NOT NULL,
                        size_bytes INTEGER NOT NULL,
                        payload_bytes INTEGER NOT NULL,
                        checksum TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        last_accessed_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS migration_jobs (
                        job_id TEXT PRIMARY KEY,
                        source_tier TEXT NOT NULL,
                        destination_tier TEXT NOT NULL,
                        reason TEXT NOT NULL,
                        status TEXT NOT NULL,
                        reclaim_target_bytes INTEGER NOT NULL,
                        min_idle_ms INTEGER NOT NULL DEFAULT 0,
                        min_size_bytes INTEGER NOT NULL DEFAULT 0,
                        max_size_bytes INTEGER NOT NULL DEFAULT 0,
                        failure_reason TEXT,
                        cancel_requested INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER NOT NULL DEFAULT 0,
                        completed_at_ms INTEGER NOT NULL DEFAULT 0,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS migration_job_records (
                        job_id TEXT NOT NULL,
                        record_id TEXT NOT NULL,
                        seq INTEGER NOT NULL,
                        state TEXT NOT NULL,
                        size_bytes INTEGER NOT NULL,
                        blob_bytes INTEGER NOT NULL DEFAULT 0,
                        source_checksum TEXT,
                        blob_checksum TEXT,
                        error_kind TEXT,
                        error TEXT,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(job_id, record_id),
                        FOREIGN KEY(job_id) REFERENCES migration_jobs(job_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS quota_snapshots (
                        tier_id TEXT PRIMARY KEY,
                        used_bytes INTEGER NOT NULL,
                        capacity_bytes INTEGER NOT NULL,
                        usage_percent REAL NOT NULL,
                        taken_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS lifecycle_log (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        record_id TEXT NOT NULL,
                        operation TEXT NOT NULL,
                        from_tier TEXT,
                        to_tier TEXT,
                        job_id TEXT,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);

            // One non-terminal job per tier pair, enforced across processes.
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS ux_migration_jobs_active_pair
                    ON migration_jobs(source_tier, destination_tier)
                    WHERE status NOT IN ('COMPLETED', 'FAILED')
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_records_tier_accessed ON records(tier_id, last_accessed_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_records_tier_created ON records(tier_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_job_records_record ON migration_job_records(record_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status ON migration_jobs(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_lifecycle_occurred ON lifecycle_log(occurred_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
