package ru.jobquest.bot.service;

import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.model.Quest;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Commands a player can issue. Every call is exactly one
 * {@link PlayerStateManager#mutate} (or one read for the profile).
 */
public final class ActionRouter {

    private final PlayerStateManager players;
    private final QuestCatalog catalog;
    private final Clock clock;
    private final Random random;
    private final long penaltyXp;

    public ActionRouter(PlayerStateManager players, QuestCatalog catalog, Clock clock, Random random, long penaltyXp) {
        this.players = Objects.requireNonNull(players);
        this.catalog = Objects.requireNonNull(catalog);
        this.clock = Objects.requireNonNull(clock);
        this.random = Objects.requireNonNull(random);
        if (penaltyXp <= 0) throw new IllegalArgumentException("penaltyXp must be positive");
        this.penaltyXp = penaltyXp;
    }

    public PlayerRecord profile(long userId) {
        return players.getOrCreate(userId);
    }

    /**
     * @throws InvalidQuestException      before anything is touched, if the id is unknown
     * @throws InconsistentModeException  if the player is in the middle of writing a note
     */
    public List<ActivityEntry> completeQuest(long userId, String questId) {
        Quest quest = catalog.require(questId);
        return players.mutate(userId, r -> ProgressionEngine.applyQuest(r, quest, random, clock.instant()));
    }

    public void beginNote(long userId) {
        players.mutate(userId, r -> ProgressionEngine.beginNote(r, clock.instant()));
    }

    public void submitNote(long userId, String text) {
        players.mutate(userId, r -> ProgressionEngine.addNote(r, text, clock.instant()));
    }

    public void cancelInput(long userId) {
        players.mutate(userId, r -> ProgressionEngine.cancelInput(r, clock.instant()));
    }

    /**
     * Answer to a reminder. Admitting inactivity costs the penalty right away;
     * otherwise the reminder is closed and a quest is still expected.
     *
     * @return the penalty event when inactivity was admitted, otherwise empty
     */
    public List<ActivityEntry> replyToReminder(long userId, boolean admitsInactivity) {
        if (admitsInactivity) {
            return players.mutate(userId, r -> ProgressionEngine.admitInactivity(r, penaltyXp, clock.instant()));
        }
        return players.mutate(userId, r -> ProgressionEngine.confirmProgress(r, clock.instant()));
    }

    public QuestCatalog catalog() {
        return catalog;
    }

    public long penaltyXp() {
        return penaltyXp;
    }
}
