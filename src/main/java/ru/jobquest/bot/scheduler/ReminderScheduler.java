package ru.jobquest.bot.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.InputMode;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.service.PlayerStateManager;
import ru.jobquest.bot.service.ProgressionEngine;
import ru.jobquest.bot.service.StorageFailureException;
import ru.jobquest.bot.service.Transition;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Accountability sweep. On every tick each known player is either reminded,
 * penalized for an unanswered reminder, or left alone.
 *
 * <p>The decision is taken inside {@link PlayerStateManager#tryMutate} against the
 * record as it is under the lock, never against an earlier snapshot. A player
 * whose lock is busy longer than {@code lockWait} is skipped and looked at again
 * on the next tick.
 */
public final class ReminderScheduler {
    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    public enum Outcome {
        REMINDED,
        PENALIZED,
        NOTHING,
        SKIPPED_BUSY,
        FAILED
    }

    public record TickReport(int reminded, int penalized, int skipped, int failed) {}

    private final PlayerStateManager players;
    private final ReminderListener listener;
    private final Clock clock;
    private final Duration interval;
    private final Duration grace;
    private final long penaltyXp;
    private final Duration tickPeriod;
    private final Duration lockWait;

    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "jobquest-reminders");
        t.setDaemon(true);
        return t;
    });

    public ReminderScheduler(
            PlayerStateManager players,
            ReminderListener listener,
            Clock clock,
            Duration interval,
            Duration grace,
            long penaltyXp,
            Duration tickPeriod,
            Duration lockWait
    ) {
        this.players = Objects.requireNonNull(players);
        this.listener = Objects.requireNonNull(listener);
        this.clock = Objects.requireNonNull(clock);
        this.interval = Objects.requireNonNull(interval);
        this.grace = Objects.requireNonNull(grace);
        if (penaltyXp <= 0) throw new IllegalArgumentException("penaltyXp must be positive");
        this.penaltyXp = penaltyXp;
        this.tickPeriod = Objects.requireNonNull(tickPeriod);
        this.lockWait = Objects.requireNonNull(lockWait);
    }

    public void start() {
        long periodMs = tickPeriod.toMillis();
        exec.scheduleAtFixedRate(this::tickSafe, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Reminder scheduler started: every {}, interval {}, grace {}, penalty {} xp",
                tickPeriod, interval, grace, penaltyXp);
    }

    public void stop() {
        exec.shutdownNow();
    }

    private void tickSafe() {
        try {
            tick();
        } catch (Exception e) {
            // an exception would cancel the periodic task
            log.error("Reminder tick failed", e);
        }
    }

    public TickReport tick() {
        Set<Long> ids;
        try {
            ids = players.knownUserIds();
        } catch (StorageFailureException e) {
            log.warn("Cannot list players, sweeping cached ones only: {}", e.getMessage());
            ids = players.cachedUserIds();
        }

        int reminded = 0, penalized = 0, skipped = 0, failed = 0;
        for (long userId : ids) {
            switch (evaluate(userId)) {
                case REMINDED -> reminded++;
                case PENALIZED -> penalized++;
                case SKIPPED_BUSY -> skipped++;
                case FAILED -> failed++;
                case NOTHING -> { }
            }
        }
        TickReport report = new TickReport(reminded, penalized, skipped, failed);
        log.debug("Reminder tick over {} players: {}", ids.size(), report);
        return report;
    }

    /** Runs the per-player state machine once. */
    public Outcome evaluate(long userId) {
        Outcome[] decided = {Outcome.NOTHING};
        Optional<List<ActivityEntry>> result;
        try {
            result = players.tryMutate(userId, lockWait, r -> {
                Instant now = clock.instant();
                Transition t = decide(r, now);
                decided[0] = t.changed()
                        ? (t.events().isEmpty() ? Outcome.REMINDED : Outcome.PENALIZED)
                        : Outcome.NOTHING;
                return t;
            });
        } catch (StorageFailureException e) {
            // state unchanged, the next tick tries again
            log.warn("Player {} not evaluated: {}", userId, e.getMessage());
            return Outcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Player {} not evaluated", userId, e);
            return Outcome.FAILED;
        }

        if (result.isEmpty()) {
            log.debug("Player {} busy, deferred to next tick", userId);
            return Outcome.SKIPPED_BUSY;
        }

        try {
            if (decided[0] == Outcome.REMINDED) {
                log.info("Reminder sent to player {}", userId);
                listener.deliverReminder(userId);
            } else if (decided[0] == Outcome.PENALIZED) {
                log.info("Player {} penalized: {}", userId, result.get());
                listener.penaltyApplied(userId, result.get());
            }
        } catch (RuntimeException e) {
            log.warn("Could not notify player {} ({})", userId, decided[0], e);
        }
        return decided[0];
    }

    Transition decide(PlayerRecord r, Instant now) {
        if (r.inputMode == InputMode.AWAITING_NOTE) {
            return Transition.unchanged(r);
        }
        if (r.inputMode == InputMode.IDLE && ProgressionEngine.dueForReminder(r, now, interval)) {
            return ProgressionEngine.sendReminder(r, now);
        }
        if (ProgressionEngine.reminderIsOverdue(r, now, grace)) {
            return ProgressionEngine.expireReminder(r, penaltyXp, now);
        }
        return Transition.unchanged(r);
    }
}
