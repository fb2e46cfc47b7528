package ru.jobquest.bot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.store.PlayerStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single path through which player records are read or written.
 *
 * <p>Each user gets a slot holding a lock and the authoritative in-memory record.
 * Slots are created on first contact and kept for the life of the process.
 * All mutations of one user are serialized on the slot lock and written through
 * to the {@link PlayerStore} before the cached record is replaced; different users
 * never share a lock.
 */
public final class PlayerStateManager {
    private static final Logger log = LoggerFactory.getLogger(PlayerStateManager.class);

    @FunctionalInterface
    public interface Transform {
        /**
         * @param current a private copy of the current record, free to modify
         */
        Transition apply(PlayerRecord current);
    }

    private static final class Slot {
        final ReentrantLock lock = new ReentrantLock();
        PlayerRecord record; // guarded by lock, null until loaded
    }

    private final PlayerStore store;
    private final Clock clock;
    private final ConcurrentHashMap<Long, Slot> players = new ConcurrentHashMap<>();

    public PlayerStateManager(PlayerStore store, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Snapshot of the player's record, loading or creating it on first contact.
     * The returned copy is detached from the manager.
     */
    public PlayerRecord getOrCreate(long userId) {
        Slot slot = slot(userId);
        slot.lock.lock();
        try {
            return loadLocked(userId, slot).copy();
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Applies {@code transform} under the user's lock and persists the result.
     *
     * @return the events of the transition, already appended to the activity log
     * @throws StorageFailureException if the record could not be loaded or written;
     *                                 the cached record is then unchanged
     */
    public List<ActivityEntry> mutate(long userId, Transform transform) {
        Slot slot = slot(userId);
        slot.lock.lock();
        try {
            return applyLocked(userId, slot, transform);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Same as {@link #mutate} but gives up when the lock is not free within {@code maxWait}.
     *
     * @return empty if the lock was not acquired (nothing was applied)
     */
    public Optional<List<ActivityEntry>> tryMutate(long userId, Duration maxWait, Transform transform) {
        Slot slot = slot(userId);
        boolean locked;
        try {
            locked = slot.lock.tryLock(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        if (!locked) return Optional.empty();
        try {
            return Optional.of(applyLocked(userId, slot, transform));
        } finally {
            slot.lock.unlock();
        }
    }

    /** Users in the store plus users only seen in this process so far. */
    public Set<Long> knownUserIds() {
        Set<Long> ids = new LinkedHashSet<>(store.listUserIds());
        ids.addAll(players.keySet());
        return ids;
    }

    public Set<Long> cachedUserIds() {
        return Set.copyOf(players.keySet());
    }

    private Slot slot(long userId) {
        return players.computeIfAbsent(userId, id -> new Slot());
    }

    private PlayerRecord loadLocked(long userId, Slot slot) {
        if (slot.record != null) return slot.record;
        Optional<PlayerRecord> stored;
        try {
            stored = store.get(userId);
        } catch (StorageFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageFailureException("Failed to load player " + userId, e);
        }
        PlayerRecord r;
        if (stored.isPresent()) {
            r = stored.get();
        } else {
            r = PlayerRecord.newPlayer(userId, clock.instant());
            write(r);
            log.info("New player {}", userId);
        }
        slot.record = r;
        return r;
    }

    private List<ActivityEntry> applyLocked(long userId, Slot slot, Transform transform) {
        PlayerRecord current = loadLocked(userId, slot);
        Transition t = transform.apply(current.copy());
        if (!t.changed()) return t.events();

        PlayerRecord next = t.record();
        next.userId = userId;
        checkInvariants(current, next);
        next.activityLog = new ArrayList<>(next.activityLog);
        next.activityLog.addAll(t.events());
        next.updatedAt = clock.instant();

        write(next);
        slot.record = next;
        if (!t.events().isEmpty()) log.debug("Player {}: {}", userId, t.events());
        return t.events();
    }

    private void write(PlayerRecord r) {
        try {
            store.put(r);
        } catch (StorageFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageFailureException("Failed to save player " + r.userId, e);
        }
    }

    private static void checkInvariants(PlayerRecord before, PlayerRecord after) {
        if (after.xp < 0 || after.gold < 0) {
            throw new IllegalStateException("negative counters for " + after.userId + ": xp=" + after.xp + " gold=" + after.gold);
        }
        if (after.level < before.level) {
            throw new IllegalStateException("level decreased for " + after.userId + ": " + before.level + " -> " + after.level);
        }
        if (!after.activityLog.equals(before.activityLog)
                || after.notes.size() < before.notes.size()
                || !after.notes.subList(0, before.notes.size()).equals(before.notes)) {
            throw new IllegalStateException("journal rewritten for " + after.userId);
        }
    }
}
