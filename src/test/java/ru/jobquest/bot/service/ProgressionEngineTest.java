package ru.jobquest.bot.service;

import org.junit.jupiter.api.Test;
import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.EventKind;
import ru.jobquest.bot.model.InputMode;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.model.Quest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressionEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
    private static final Duration INTERVAL = Duration.ofMinutes(15);

    private static final Quest APPLY = new Quest("apply", "💼", "Apply for a job", 50, 1, 2);
    private static final Quest STUDY = new Quest("study", "🧠", "Study", 15, 0, 0);

    @Test
    void levelForFollowsThresholdTable() {
        assertEquals(1, ProgressionEngine.levelFor(0));
        assertEquals(1, ProgressionEngine.levelFor(39));
        assertEquals(2, ProgressionEngine.levelFor(40));
        assertEquals(3, ProgressionEngine.levelFor(100));
        assertEquals(9, ProgressionEngine.levelFor(1599));
        assertEquals(10, ProgressionEngine.levelFor(1600));
    }

    @Test
    void levelForExtrapolatesPastTheTable() {
        assertEquals(10, ProgressionEngine.levelFor(1999));
        assertEquals(11, ProgressionEngine.levelFor(2000));
        assertEquals(12, ProgressionEngine.levelFor(2400));
        assertEquals(2000, ProgressionEngine.xpForLevel(11));
        assertEquals(ProgressionEngine.levelFor(ProgressionEngine.xpForLevel(37)), 37);
    }

    @Test
    void levelForRejectsNegativeXp() {
        assertThrows(IllegalArgumentException.class, () -> ProgressionEngine.levelFor(-1));
    }

    @Test
    void levelIsMonotonicAndMatchesRecomputationOverQuestSequences() {
        Random random = new Random(42);
        List<Quest> quests = List.of(APPLY, STUDY, new Quest("big", "🛠️", "Big", 370, 0, 3));
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        long runningXp = 0;
        for (int i = 0; i < 500; i++) {
            Quest q = quests.get(random.nextInt(quests.size()));
            int before = r.level;
            r = ProgressionEngine.applyQuest(r, q, random, T0.plusSeconds(i)).record();
            runningXp += q.xpReward();

            assertTrue(r.level >= before);
            assertEquals(runningXp, r.xp);
            assertEquals(ProgressionEngine.levelFor(runningXp), r.level);
        }
    }

    @Test
    void applyingForAJobFromScratchLevelsUp() {
        PlayerRecord start = PlayerRecord.newPlayer(1, T0);
        Instant at = T0.plusSeconds(60);

        Transition t = ProgressionEngine.applyQuest(start, APPLY, new Random(7), at);

        PlayerRecord r = t.record();
        assertEquals(50, r.xp);
        assertEquals(2, r.level);
        assertTrue(r.gold >= 1 && r.gold <= 2);
        assertEquals(at, r.lastActivityAt);

        List<ActivityEntry> events = t.events();
        assertEquals(2, events.size());
        assertEquals(EventKind.QUEST_COMPLETED, events.get(0).kind());
        assertEquals("Apply for a job", events.get(0).questName());
        assertEquals(50, events.get(0).xpDelta());
        assertEquals(r.gold, events.get(0).goldDelta());
        assertEquals(EventKind.LEVEL_UP, events.get(1).kind());
        assertEquals(2, events.get(1).level());
    }

    @Test
    void goldStaysWithinInclusiveRange() {
        Quest wide = new Quest("w", "🎲", "Wide", 1, 3, 5);
        Random random = new Random(1);
        boolean sawMin = false, sawMax = false;
        for (int i = 0; i < 1000; i++) {
            long g = ProgressionEngine.rollGold(wide, random);
            assertTrue(g >= 3 && g <= 5, "gold " + g);
            sawMin |= g == 3;
            sawMax |= g == 5;
        }
        assertTrue(sawMin && sawMax);
    }

    @Test
    void applyQuestDoesNotTouchTheInputRecord() {
        PlayerRecord start = PlayerRecord.newPlayer(1, T0);
        ProgressionEngine.applyQuest(start, APPLY, new Random(), T0.plusSeconds(5));
        assertEquals(0, start.xp);
        assertEquals(1, start.level);
        assertTrue(start.activityLog.isEmpty());
        assertEquals(T0, start.lastActivityAt);
    }

    @Test
    void penaltyClampsXpAtZero() {
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        r.xp = 5;
        r.inputMode = InputMode.AWAITING_PROCRASTINATION_REPLY;

        Transition t = ProgressionEngine.applyPenalty(r, 20, T0.plusSeconds(1));

        assertEquals(0, t.record().xp);
        assertEquals(1, t.events().size());
        assertEquals(EventKind.PENALTY_APPLIED, t.events().get(0).kind());
        assertEquals(-5, t.events().get(0).xpDelta());
        assertEquals(T0, t.record().lastActivityAt);
        assertEquals(InputMode.AWAITING_PROCRASTINATION_REPLY, t.record().inputMode);
    }

    @Test
    void penaltyNeverDemotes() {
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        r = ProgressionEngine.applyQuest(r, APPLY, new Random(), T0).record();
        assertEquals(2, r.level);

        r = ProgressionEngine.applyPenalty(r, 20, T0).record();
        assertEquals(30, r.xp);
        assertEquals(2, r.level);

        // earning back up to 45 xp must not emit another level-up
        Transition t = ProgressionEngine.applyQuest(r, STUDY, new Random(), T0);
        assertEquals(2, t.record().level);
        assertEquals(1, t.events().size());
    }

    @Test
    void penaltyMustBePositive() {
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        assertThrows(IllegalArgumentException.class, () -> ProgressionEngine.applyPenalty(r, 0, T0));
        assertThrows(IllegalArgumentException.class, () -> ProgressionEngine.applyPenalty(r, -3, T0));
    }

    @Test
    void reminderBecomesDueExactlyAtInterval() {
        PlayerRecord r = ProgressionEngine.applyQuest(PlayerRecord.newPlayer(1, T0), STUDY, new Random(), T0).record();

        assertFalse(ProgressionEngine.dueForReminder(r, T0, INTERVAL));
        assertFalse(ProgressionEngine.dueForReminder(r, T0.plus(INTERVAL).minusSeconds(1), INTERVAL));
        assertTrue(ProgressionEngine.dueForReminder(r, T0.plus(INTERVAL), INTERVAL));
    }

    @Test
    void reminderIsNotDueWhileOneIsPending() {
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        r = ProgressionEngine.sendReminder(r, T0.plus(INTERVAL)).record();
        assertFalse(ProgressionEngine.dueForReminder(r, T0.plus(INTERVAL.multipliedBy(10)), INTERVAL));
    }

    @Test
    void reminderIsOverdueAfterGrace() {
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        assertFalse(ProgressionEngine.reminderIsOverdue(r, T0.plus(Duration.ofDays(1)), INTERVAL));

        r = ProgressionEngine.sendReminder(r, T0).record();
        assertFalse(ProgressionEngine.reminderIsOverdue(r, T0.plus(INTERVAL).minusMillis(1), INTERVAL));
        assertTrue(ProgressionEngine.reminderIsOverdue(r, T0.plus(INTERVAL), INTERVAL));
    }

    @Test
    void questAnswersAPendingReminder() {
        PlayerRecord r = ProgressionEngine.sendReminder(PlayerRecord.newPlayer(1, T0), T0).record();
        assertEquals(InputMode.AWAITING_PROCRASTINATION_REPLY, r.inputMode);

        PlayerRecord after = ProgressionEngine.applyQuest(r, STUDY, new Random(), T0.plusSeconds(30)).record();

        assertNull(after.pendingReminderAt);
        assertEquals(InputMode.IDLE, after.inputMode);
    }

    @Test
    void questIsRejectedWhileWritingANote() {
        PlayerRecord r = ProgressionEngine.beginNote(PlayerRecord.newPlayer(1, T0), T0).record();

        InconsistentModeException e = assertThrows(InconsistentModeException.class,
                () -> ProgressionEngine.applyQuest(r, STUDY, new Random(), T0));
        assertEquals(InputMode.AWAITING_NOTE, e.actual());
    }

    @Test
    void noteFlowReturnsToIdle() {
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        assertThrows(InconsistentModeException.class, () -> ProgressionEngine.addNote(r, "hi", T0));

        PlayerRecord writing = ProgressionEngine.beginNote(r, T0).record();
        assertThrows(IllegalArgumentException.class, () -> ProgressionEngine.addNote(writing, "   ", T0));

        PlayerRecord done = ProgressionEngine.addNote(writing, "  called HR  ", T0.plusSeconds(3)).record();
        assertEquals(InputMode.IDLE, done.inputMode);
        assertEquals(1, done.notes.size());
        assertEquals("called HR", done.notes.get(0).text());
        assertEquals(T0.plusSeconds(3), done.notes.get(0).at());
    }

    @Test
    void cancelInputCannotDismissAReminder() {
        PlayerRecord idle = PlayerRecord.newPlayer(1, T0);
        assertFalse(ProgressionEngine.cancelInput(idle, T0).changed());

        PlayerRecord reminded = ProgressionEngine.sendReminder(idle, T0).record();
        assertThrows(InconsistentModeException.class, () -> ProgressionEngine.cancelInput(reminded, T0));
    }

    @Test
    void admittingInactivityPenalizesAndClosesTheReminder() {
        PlayerRecord r = PlayerRecord.newPlayer(1, T0);
        r.xp = 100;
        r.level = 3;
        r = ProgressionEngine.sendReminder(r, T0).record();

        Transition t = ProgressionEngine.admitInactivity(r, 20, T0.plusSeconds(10));

        assertEquals(80, t.record().xp);
        assertNull(t.record().pendingReminderAt);
        assertEquals(InputMode.IDLE, t.record().inputMode);
        assertEquals(1, t.events().size());
    }
}
