package io.sweepmesh.storage;

import io.sweepmesh.config.SweepMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "sweepmesh.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5000;

    private final SweepMeshConfig config;
    private final String jdbcUrl;

    public Database(SweepMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public SweepMeshConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Every connection enforces foreign keys and waits on a locked database instead of failing fast.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("foreign_keys", "true");
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.artifactsRoot());
            Files.createDirectories(config.eventsRoot());
        } catch (IOException e) {
            throw new StoreException("Failed to initialize directories under " + config.rootDir(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS targets (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        url TEXT NOT NULL UNIQUE,
                        name TEXT,
                        run_count INTEGER NOT NULL DEFAULT 0,
                        last_run_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        target_id INTEGER NOT NULL,
                        name TEXT,
                        mode TEXT NOT NULL,
                        config_json TEXT NOT NULL,
                        status TEXT NOT NULL,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(target_id) REFERENCES targets(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        run_id INTEGER NOT NULL,
                        params_json TEXT NOT NULL,
                        params_key TEXT NOT NULL,
                        status TEXT NOT NULL,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        lease_owner TEXT,
                        lease_epoch INTEGER NOT NULL DEFAULT 0,
                        last_error TEXT,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(run_id) REFERENCES runs(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS results (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id INTEGER NOT NULL UNIQUE,
                        pl REAL,
                        cagr REAL,
                        max_drawdown REAL,
                        mar REAL,
                        win_percentage REAL,
                        total_premium REAL,
                        capture_rate REAL,
                        starting_capital REAL,
                        ending_capital REAL,
                        total_trades INTEGER,
                        winners INTEGER,
                        avg_per_trade REAL,
                        avg_winner REAL,
                        avg_loser REAL,
                        max_winner REAL,
                        max_loser REAL,
                        avg_minutes_in_trade REAL,
                        raw_data_json TEXT,
                        cached_from_task_id INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(task_id) REFERENCES tasks(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS failures (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id INTEGER NOT NULL,
                        attempt_number INTEGER NOT NULL,
                        failure_type TEXT NOT NULL,
                        error_message TEXT,
                        screenshot_path TEXT,
                        html_path TEXT,
                        console_log_json TEXT,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(task_id) REFERENCES tasks(id)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_target ON runs(target_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_run_status ON tasks(run_id, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_failures_task ON failures(task_id)");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261019_001_cache_lookup_index",
                "Index completed tasks by parameter key for result reuse",
                List.of("CREATE INDEX IF NOT EXISTS idx_tasks_params_key_status ON tasks(params_key, status)")
        ));
        steps.add(new MigrationStep(
                "20261019_002_result_provenance_index",
                "Index cache-synthesized results by source task",
                List.of("CREATE INDEX IF NOT EXISTS idx_results_cached_from ON results(cached_from_task_id)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    public List<String> appliedMigrations() {
        List<String> out = new ArrayList<>();
        try (Connection c = openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT version FROM schema_migrations WHERE success=1 ORDER BY version")) {
            while (rs.next()) {
                out.add(rs.getString("version"));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list schema migrations", e);
        }
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StoreException("Failed to apply SQLite pragmas", e);
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
