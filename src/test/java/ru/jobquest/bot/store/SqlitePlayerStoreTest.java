package ru.jobquest.bot.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.jobquest.bot.db.Database;
import ru.jobquest.bot.db.Schema;
import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.InputMode;
import ru.jobquest.bot.model.Note;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.service.StorageFailureException;
import ru.jobquest.bot.util.JsonUtils;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlitePlayerStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    @TempDir
    Path dir;

    private Database db;
    private SqlitePlayerStore store;

    @BeforeEach
    void setUp() throws Exception {
        db = new Database(dir.resolve("nested").resolve("players.db"));
        Schema.migrate(db);
        store = new SqlitePlayerStore(db);
    }

    @Test
    void missingPlayerIsAbsent() {
        assertTrue(store.get(42).isEmpty());
        assertTrue(store.listUserIds().isEmpty());
    }

    @Test
    void fullRecordSurvivesAReload() {
        PlayerRecord r = PlayerRecord.newPlayer(42, T0);
        r.xp = 130;
        r.level = 3;
        r.gold = 7;
        r.inputMode = InputMode.AWAITING_PROCRASTINATION_REPLY;
        r.pendingReminderAt = T0.plusSeconds(900);
        r.notes.add(new Note(T0.plusSeconds(5), "<b>не</b> забыть & позвонить"));
        r.activityLog.add(ActivityEntry.questCompleted(T0.plusSeconds(1), "Учёба", 15, 0, 1));
        r.activityLog.add(ActivityEntry.penaltyApplied(T0.plusSeconds(2), -20, 3));

        store.put(r);

        PlayerRecord loaded = store.get(42).orElseThrow();
        assertEquals(JsonUtils.GSON.toJson(r), JsonUtils.GSON.toJson(loaded));
        assertEquals(r.activityLog, loaded.activityLog);
        assertEquals(r.notes, loaded.notes);
        assertEquals(List.of(42L), store.listUserIds());
    }

    @Test
    void updatedAtColumnFollowsTheRecordNotTheWallClock() throws Exception {
        PlayerRecord r = PlayerRecord.newPlayer(5, T0);
        r.updatedAt = T0.plusSeconds(600);
        store.put(r);

        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT updated_at FROM players WHERE user_id=?")) {
            ps.setLong(1, 5);
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("2024-03-01T09:10:00Z", rs.getString(1));
            }
        }
    }

    @Test
    void putReplacesThePreviousValue() {
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        store.put(r);
        r.gold = 99;
        store.put(r);

        assertEquals(99, store.get(1).orElseThrow().gold);
        assertEquals(1, store.listUserIds().size());
    }

    @Test
    void unknownFieldsAreIgnoredAndMissingOnesDefaulted() throws Exception {
        insertRaw(5, "{\"xp\":45,\"gold\":2,\"favouriteColor\":\"green\",\"inputMode\":\"SLEEPING\"}");

        PlayerRecord r = store.get(5).orElseThrow();

        assertEquals(5, r.userId);
        assertEquals(45, r.xp);
        assertEquals(2, r.level); // recomputed from xp
        assertEquals(2, r.gold);
        assertEquals(InputMode.IDLE, r.inputMode);
        assertTrue(r.notes.isEmpty());
        assertTrue(r.activityLog.isEmpty());
        assertNull(r.pendingReminderAt);
    }

    @Test
    void corruptRowIsAStorageFailure() throws Exception {
        insertRaw(6, "{not json");
        assertThrows(StorageFailureException.class, () -> store.get(6));

        insertRaw(7, "{\"lastActivityAt\":\"yesterday\"}");
        assertThrows(StorageFailureException.class, () -> store.get(7));
    }

    @Test
    void missingTableIsAStorageFailure() throws Exception {
        SqlitePlayerStore fresh = new SqlitePlayerStore(new Database(dir.resolve("empty.db")));
        assertThrows(StorageFailureException.class, () -> fresh.put(PlayerRecord.newPlayer(1, T0)));
    }

    private void insertRaw(long userId, String json) throws Exception {
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement("INSERT INTO players(user_id, data, updated_at) VALUES(?,?,?)")) {
            ps.setLong(1, userId);
            ps.setString(2, json);
            ps.setString(3, T0.toString());
            ps.executeUpdate();
        }
    }
}
