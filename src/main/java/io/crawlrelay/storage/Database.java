package io.crawlrelay.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * JDBC access to the error-bookkeeping store. SQLite by default; any JDBC URL
 * whose driver is on the classpath works for the insert path.
 */
public final class Database {
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    private final String jdbcUrl;

    public Database(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl cannot be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
    }

    public static Database sqlite(Path dbFile) {
        return new Database(SQLITE_PREFIX + dbFile.toAbsolutePath().normalize());
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public void init() {
        initDirectories();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private void initDirectories() {
        if (!jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String location = jdbcUrl.substring(SQLITE_PREFIX.length());
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        Path parent = Path.of(location).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize database directory: " + parent, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS crawler_error_logs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        subscription_name TEXT NOT NULL,
                        error_genre TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE INDEX IF NOT EXISTS idx_crawler_error_logs_sub_created
                    ON crawler_error_logs(subscription_name, created_at_ms)
                    """);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema: " + jdbcUrl, e);
        }
    }
}
