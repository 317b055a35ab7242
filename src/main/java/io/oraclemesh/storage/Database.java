package io.oraclemesh.storage;

import io.oraclemesh.config.OracleMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final OracleMeshConfig config;
    private final String jdbcUrl;

    public Database(OracleMeshConfig config) {
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
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.recordsRoot());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
            Files.createDirectories(config.arbitrationPending());
            Files.createDirectories(config.arbitrationResolved());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ledger_commitments (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        store_key TEXT NOT NULL UNIQUE,
                        digest TEXT NOT NULL,
                        contract_address TEXT NOT NULL,
                        committed_at TEXT NOT NULL,
                        committed_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS ledger_conflicts (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        store_key TEXT NOT NULL,
                        stored_digest TEXT NOT NULL,
                        attempted_digest TEXT NOT NULL,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_ledger_commitments_time ON ledger_commitments(committed_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_ledger_conflicts_key ON ledger_conflicts(store_key, occurred_at_ms)");
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
