package ru.jobquest.bot.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final Path path;
    private final String jdbcUrl;

    public Database(Path path) throws IOException {
        this.path = Objects.requireNonNull(path).toAbsolutePath();
        Path parent = this.path.getParent();
        if (parent != null) Files.createDirectories(parent);
        this.jdbcUrl = "jdbc:sqlite:" + this.path;
    }

    public Connection getConnection() throws SQLException {
        Connection c = DriverManager.getConnection(jdbcUrl);
        // WAL lets the scheduler read while an update handler writes.
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL;");
            st.execute("PRAGMA synchronous=FULL;");
            st.execute("PRAGMA busy_timeout=5000;");
        } catch (SQLException e) {
            log.warn("Could not apply sqlite pragmas on {}: {}", path, e.getMessage());
        }
        return c;
    }

    public Path path() {
        return path;
    }
}
