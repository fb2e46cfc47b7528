package ru.jobquest.bot.store;

import com.google.gson.JsonParseException;
import ru.jobquest.bot.db.Database;
import ru.jobquest.bot.model.InputMode;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.service.ProgressionEngine;
import ru.jobquest.bot.service.StorageFailureException;
import ru.jobquest.bot.util.JsonUtils;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SqlitePlayerStore implements PlayerStore {

    private final Database db;

    public SqlitePlayerStore(Database db) {
        this.db = Objects.requireNonNull(db);
    }

    @Override
    public Optional<PlayerRecord> get(long userId) {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT data FROM players WHERE user_id=?")) {
                ps.setLong(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) return Optional.empty();
                    return Optional.of(decode(userId, rs.getString("data")));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to load player " + userId, e);
        }
    }

    @Override
    public void put(PlayerRecord record) {
        String json = JsonUtils.GSON.toJson(record);
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO players(user_id, data, updated_at) VALUES(?,?,?) " +
                            "ON CONFLICT(user_id) DO UPDATE SET data=excluded.data, updated_at=excluded.updated_at"
            )) {
                ps.setLong(1, record.userId);
                ps.setString(2, json);
                ps.setString(3, String.valueOf(record.updatedAt != null ? record.updatedAt : record.createdAt));
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to save player " + record.userId, e);
        }
    }

    @Override
    public List<Long> listUserIds() {
        List<Long> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT user_id FROM players ORDER BY user_id")) {
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(rs.getLong(1));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailureException("Failed to list players", e);
        }
        return out;
    }

    static PlayerRecord decode(long userId, String json) {
        PlayerRecord r;
        try {
            r = JsonUtils.GSON.fromJson(json, PlayerRecord.class);
        } catch (JsonParseException | DateTimeParseException e) {
            throw new StorageFailureException("Corrupt record for player " + userId, e);
        }
        if (r == null) throw new StorageFailureException("Empty record for player " + userId, null);
        return normalize(userId, r);
    }

    // Older rows may lack fields that were added later.
    private static PlayerRecord normalize(long userId, PlayerRecord r) {
        r.userId = userId;
        if (r.inputMode == null) r.inputMode = InputMode.IDLE;
        if (r.notes == null) r.notes = new ArrayList<>();
        if (r.activityLog == null) r.activityLog = new ArrayList<>();
        if (r.xp < 0) r.xp = 0;
        if (r.gold < 0) r.gold = 0;
        r.level = Math.max(Math.max(1, r.level), ProgressionEngine.levelFor(r.xp));
        if (r.lastActivityAt == null) r.lastActivityAt = r.createdAt;
        return r;
    }
}
