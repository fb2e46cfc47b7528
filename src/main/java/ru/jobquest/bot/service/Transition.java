package ru.jobquest.bot.service;

import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.PlayerRecord;

import java.util.List;
import java.util.Objects;

/**
 * Result of a transform: the next record and the events it produced.
 * {@code changed == false} means nothing needs to be written.
 */
public record Transition(PlayerRecord record, List<ActivityEntry> events, boolean changed) {

    public Transition {
        Objects.requireNonNull(record);
        events = List.copyOf(events);
    }

    public static Transition of(PlayerRecord record, List<ActivityEntry> events) {
        return new Transition(record, events, true);
    }

    public static Transition of(PlayerRecord record) {
        return new Transition(record, List.of(), true);
    }

    public static Transition unchanged(PlayerRecord record) {
        return new Transition(record, List.of(), false);
    }
}
