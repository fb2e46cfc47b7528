package ru.jobquest.bot.model;

public enum EventKind {
    QUEST_COMPLETED,
    LEVEL_UP,
    PENALTY_APPLIED
}
