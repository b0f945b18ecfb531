package io.taskgraph.store;

import io.taskgraph.config.TaskGraphConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final Path dbFile;
    private final String jdbcUrl;

    public Database(TaskGraphConfig config) {
        this(config.dbFile());
    }

    public Database(Path dbFile) {
        this.dbFile = dbFile.toAbsolutePath().normalize();
        this.jdbcUrl = "jdbc:sqlite:" + this.dbFile;
    }

    public Path dbFile() {
        return dbFile;
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
            Path parent = dbFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize database directory for " + dbFile, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            // parent_id is 0 for top-level items; dependencies holds a JSON array of canonical ids
            st.execute("""
                    CREATE TABLE IF NOT EXISTS work_items (
                        parent_id INTEGER NOT NULL,
                        item_id INTEGER NOT NULL,
                        position INTEGER NOT NULL,
                        title TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL,
                        priority TEXT NOT NULL DEFAULT 'medium',
                        dependencies TEXT NOT NULL DEFAULT '[]',
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(parent_id, item_id)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_work_items_order ON work_items(parent_id, position)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
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
