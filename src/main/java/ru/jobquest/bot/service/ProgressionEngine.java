package ru.jobquest.bot.service;

import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.InputMode;
import ru.jobquest.bot.model.Note;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.model.Quest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Pure progression rules. Every method works on a copy of the given record and
 * never touches the original, so the caller decides whether the result is kept.
 */
public final class ProgressionEngine {

    private ProgressionEngine() {}

    /** Cumulative xp at which level {@code i + 1} starts. */
    static final long[] LEVEL_THRESHOLDS = {0, 40, 100, 180, 300, 450, 650, 900, 1200, 1600};

    private static final long TAIL_STEP =
            LEVEL_THRESHOLDS[LEVEL_THRESHOLDS.length - 1] - LEVEL_THRESHOLDS[LEVEL_THRESHOLDS.length - 2];

    public static int levelFor(long xp) {
        if (xp < 0) throw new IllegalArgumentException("xp < 0: " + xp);
        long last = LEVEL_THRESHOLDS[LEVEL_THRESHOLDS.length - 1];
        if (xp >= last) {
            long extra = (xp - last) / TAIL_STEP;
            return (int) Math.min(Integer.MAX_VALUE, LEVEL_THRESHOLDS.length + extra);
        }
        int level = 1;
        for (int i = 1; i < LEVEL_THRESHOLDS.length; i++) {
            if (xp < LEVEL_THRESHOLDS[i]) break;
            level = i + 1;
        }
        return level;
    }

    /** Cumulative xp at which {@code level} starts. */
    public static long xpForLevel(int level) {
        if (level < 1) throw new IllegalArgumentException("level < 1: " + level);
        if (level <= LEVEL_THRESHOLDS.length) return LEVEL_THRESHOLDS[level - 1];
        return LEVEL_THRESHOLDS[LEVEL_THRESHOLDS.length - 1] + (long) (level - LEVEL_THRESHOLDS.length) * TAIL_STEP;
    }

    public static LevelInfo levelInfo(PlayerRecord r) {
        return new LevelInfo(r.level, xpForLevel(r.level), xpForLevel(r.level + 1));
    }

    public record LevelInfo(int level, long from, long to) {
        public long remaining(long xp) {
            return Math.max(0, to - xp);
        }
    }

    // --- rewards & penalties ---

    public static Transition applyQuest(PlayerRecord current, Quest quest, Random random, Instant now) {
        if (current.inputMode == InputMode.AWAITING_NOTE) {
            throw new InconsistentModeException(InputMode.IDLE, current.inputMode);
        }
        PlayerRecord next = current.copy();
        long gold = rollGold(quest, random);

        next.xp = current.xp + quest.xpReward();
        next.gold = current.gold + gold;
        // a penalty may have eroded xp below the cached level's floor; level never goes down
        next.level = Math.max(current.level, levelFor(next.xp));
        next.lastActivityAt = now;

        // finishing a quest is the best answer to a pending reminder
        if (next.hasPendingReminder()) {
            next.pendingReminderAt = null;
            next.inputMode = InputMode.IDLE;
        }
        next.updatedAt = now;

        List<ActivityEntry> events = new ArrayList<>();
        events.add(ActivityEntry.questCompleted(now, quest.name(), quest.xpReward(), gold, next.level));
        if (next.level > current.level) {
            events.add(ActivityEntry.levelUp(now, next.level));
        }
        return Transition.of(next, events);
    }

    static long rollGold(Quest quest, Random random) {
        long span = quest.goldMax() - quest.goldMin();
        if (span == 0) return quest.goldMin();
        return quest.goldMin() + (long) random.nextInt((int) Math.min(Integer.MAX_VALUE - 1, span) + 1);
    }

    public static Transition applyPenalty(PlayerRecord current, long amount, Instant now) {
        if (amount <= 0) throw new IllegalArgumentException("penalty must be positive: " + amount);
        PlayerRecord next = current.copy();
        long taken = Math.min(amount, current.xp);
        next.xp = current.xp - taken;
        next.updatedAt = now;
        return Transition.of(next, List.of(ActivityEntry.penaltyApplied(now, -taken, next.level)));
    }

    // --- reminder predicates ---

    public static boolean dueForReminder(PlayerRecord r, Instant now, Duration interval) {
        if (r.hasPendingReminder()) return false;
        Instant since = r.lastActivityAt != null ? r.lastActivityAt : r.createdAt;
        if (since == null) return true;
        return Duration.between(since, now).compareTo(interval) >= 0;
    }

    public static boolean reminderIsOverdue(PlayerRecord r, Instant now, Duration grace) {
        if (!r.hasPendingReminder()) return false;
        return Duration.between(r.pendingReminderAt, now).compareTo(grace) >= 0;
    }

    // --- conversation transitions ---

    public static Transition beginNote(PlayerRecord current, Instant now) {
        requireMode(current, InputMode.IDLE);
        PlayerRecord next = current.copy();
        next.inputMode = InputMode.AWAITING_NOTE;
        next.updatedAt = now;
        return Transition.of(next);
    }

    public static Transition addNote(PlayerRecord current, String text, Instant now) {
        requireMode(current, InputMode.AWAITING_NOTE);
        if (text == null || text.isBlank()) throw new IllegalArgumentException("note text is blank");
        PlayerRecord next = current.copy();
        next.notes.add(new Note(now, text.strip()));
        next.inputMode = InputMode.IDLE;
        next.updatedAt = now;
        return Transition.of(next);
    }

    /**
     * Leaves note mode. Idle players are left untouched; a pending reminder cannot
     * be dismissed this way.
     */
    public static Transition cancelInput(PlayerRecord current, Instant now) {
        if (current.inputMode == InputMode.IDLE) return Transition.unchanged(current);
        requireMode(current, InputMode.AWAITING_NOTE);
        PlayerRecord next = current.copy();
        next.inputMode = InputMode.IDLE;
        next.updatedAt = now;
        return Transition.of(next);
    }

    public static Transition sendReminder(PlayerRecord current, Instant now) {
        requireMode(current, InputMode.IDLE);
        if (current.hasPendingReminder()) {
            throw new IllegalStateException("reminder already pending for " + current.userId);
        }
        PlayerRecord next = current.copy();
        next.pendingReminderAt = now;
        next.inputMode = InputMode.AWAITING_PROCRASTINATION_REPLY;
        next.updatedAt = now;
        return Transition.of(next);
    }

    public static Transition confirmProgress(PlayerRecord current, Instant now) {
        requireMode(current, InputMode.AWAITING_PROCRASTINATION_REPLY);
        PlayerRecord next = current.copy();
        next.pendingReminderAt = null;
        next.inputMode = InputMode.IDLE;
        next.updatedAt = now;
        return Transition.of(next);
    }

    public static Transition admitInactivity(PlayerRecord current, long penalty, Instant now) {
        requireMode(current, InputMode.AWAITING_PROCRASTINATION_REPLY);
        return expireReminder(current, penalty, now);
    }

    /** Penalty for an unanswered (or admitted) reminder; closes the reminder. */
    public static Transition expireReminder(PlayerRecord current, long penalty, Instant now) {
        Transition t = applyPenalty(current, penalty, now);
        PlayerRecord next = t.record();
        next.pendingReminderAt = null;
        if (next.inputMode == InputMode.AWAITING_PROCRASTINATION_REPLY) next.inputMode = InputMode.IDLE;
        return t;
    }

    static void requireMode(PlayerRecord r, InputMode expected) {
        if (r.inputMode != expected) throw new InconsistentModeException(expected, r.inputMode);
    }
}
