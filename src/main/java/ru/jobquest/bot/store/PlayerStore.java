package ru.jobquest.bot.store;

import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.service.StorageFailureException;

import java.util.List;
import java.util.Optional;

/**
 * Durable user id to record mapping. {@link ru.jobquest.bot.service.PlayerStateManager}
 * is its only writer.
 *
 * <p>Implementations throw {@link StorageFailureException} when an operation did not complete.
 */
public interface PlayerStore {

    /** The most recent successfully stored record, or empty. */
    Optional<PlayerRecord> get(long userId);

    /** Atomic and durable once it returns. */
    void put(PlayerRecord record);

    List<Long> listUserIds();
}
