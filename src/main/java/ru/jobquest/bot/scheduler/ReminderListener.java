package ru.jobquest.bot.scheduler;

import ru.jobquest.bot.model.ActivityEntry;

import java.util.List;

/**
 * Outbound side of the scheduler. Called after the state change is committed.
 */
public interface ReminderListener {

    void deliverReminder(long userId);

    void penaltyApplied(long userId, List<ActivityEntry> events);
}
