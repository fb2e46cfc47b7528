package ru.jobquest.bot.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Progression state of one Telegram user. Serialized as a whole into the
 * {@code players.data} column, so new fields must have a sensible default here.
 */
public final class PlayerRecord {
    public long userId;

    public long xp;
    public int level = 1;
    public long gold;

    public InputMode inputMode = InputMode.IDLE;

    public Instant lastActivityAt;
    public Instant pendingReminderAt;

    public List<Note> notes = new ArrayList<>();
    public List<ActivityEntry> activityLog = new ArrayList<>();

    public Instant createdAt;
    public Instant updatedAt;

    public static PlayerRecord newPlayer(long userId, Instant now) {
        PlayerRecord r = new PlayerRecord();
        r.userId = userId;
        r.lastActivityAt = now;
        r.createdAt = now;
        r.updatedAt = now;
        return r;
    }

    public boolean hasPendingReminder() {
        return pendingReminderAt != null;
    }

    /**
     * Copy that shares no mutable state with this record. Notes and entries are
     * immutable, so only the lists are copied.
     */
    public PlayerRecord copy() {
        PlayerRecord r = new PlayerRecord();
        r.userId = userId;
        r.xp = xp;
        r.level = level;
        r.gold = gold;
        r.inputMode = inputMode;
        r.lastActivityAt = lastActivityAt;
        r.pendingReminderAt = pendingReminderAt;
        r.notes = new ArrayList<>(notes);
        r.activityLog = new ArrayList<>(activityLog);
        r.createdAt = createdAt;
        r.updatedAt = updatedAt;
        return r;
    }
}
