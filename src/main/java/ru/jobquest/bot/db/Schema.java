package ru.jobquest.bot.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public final class Schema {

    private Schema() {}

    public static void migrate(Database db) throws SQLException {
        try (Connection c = db.getConnection()) {
            try (Statement st = c.createStatement()) {

                // One row per Telegram user; data is the JSON of PlayerRecord.
                st.execute("CREATE TABLE IF NOT EXISTS players (" +
                        "user_id INTEGER PRIMARY KEY," +
                        "data TEXT NOT NULL," +
                        "updated_at TEXT NOT NULL" +
                        ");");
            }
        }
    }
}
