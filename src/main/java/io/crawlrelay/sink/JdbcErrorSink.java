package io.crawlrelay.sink;

import io.crawlrelay.model.ErrorGenre;
import io.crawlrelay.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;

public final class JdbcErrorSink implements ErrorSink {
    private static final Logger LOG = LoggerFactory.getLogger(JdbcErrorSink.class);

    private final Database database;

    public JdbcErrorSink(Database database) {
        this.database = database;
    }

    @Override
    public boolean record(String subscription, ErrorGenre genre, Instant at) {
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT INTO crawler_error_logs (subscription_name, error_genre, created_at_ms)
                     VALUES (?, ?, ?)
                     """)) {
            ps.setString(1, subscription);
            ps.setString(2, genre.label());
            ps.setLong(3, at.toEpochMilli());
            ps.executeUpdate();
            LOG.info("Error log saved. subscription={} error_genre={}", subscription, genre.label());
            return true;
        } catch (SQLException e) {
            LOG.error("Error log insert failed. subscription={} error_genre={}", subscription, genre.label(), e);
            return false;
        }
    }
}
