package io.evalrelay.storage;

import io.evalrelay.config.EvalRelayConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final EvalRelayConfig config;
    private final String jdbcUrl;

    public Database(EvalRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.resultsDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs (
                        run_id TEXT PRIMARY KEY,
                        state TEXT NOT NULL,
                        ordering_mode TEXT NOT NULL,
                        problem_count INTEGER NOT NULL,
                        address TEXT NOT NULL,
                        result_file TEXT,
                        last_error TEXT,
                        started_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS call_records (
                        run_id TEXT NOT NULL,
                        seq INTEGER NOT NULL,
                        problem_id TEXT NOT NULL,
                        status TEXT NOT NULL,
                        answer INTEGER,
                        raw_error TEXT,
                        started_at_ms INTEGER NOT NULL,
                        deadline_at_ms INTEGER NOT NULL,
                        elapsed_ms INTEGER NOT NULL,
                        PRIMARY KEY (run_id, seq),
                        UNIQUE (run_id, problem_id),
                        FOREIGN KEY (run_id) REFERENCES runs(run_id)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_started ON runs(started_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_call_records_status ON call_records(run_id, status)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA busy_timeout=5000");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
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
