package ru.jobquest.bot.model;

import java.time.Instant;

/**
 * One line of the player's journal.
 *
 * @param questName only for {@link EventKind#QUEST_COMPLETED}
 * @param level     level after the event
 */
public record ActivityEntry(Instant at, EventKind kind, String questName, long xpDelta, long goldDelta, int level) {

    public static ActivityEntry questCompleted(Instant at, String questName, long xp, long gold, int level) {
        return new ActivityEntry(at, EventKind.QUEST_COMPLETED, questName, xp, gold, level);
    }

    public static ActivityEntry levelUp(Instant at, int level) {
        return new ActivityEntry(at, EventKind.LEVEL_UP, null, 0, 0, level);
    }

    public static ActivityEntry penaltyApplied(Instant at, long xpDelta, int level) {
        return new ActivityEntry(at, EventKind.PENALTY_APPLIED, null, xpDelta, 0, level);
    }

    @Override
    public String toString() {
        return kind + (questName != null ? "(" + questName + ")" : "") + " xp=" + xpDelta + " gold=" + goldDelta;
    }
}
