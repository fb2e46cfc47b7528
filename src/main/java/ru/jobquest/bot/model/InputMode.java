package ru.jobquest.bot.model;

/**
 * How the next free-text message of a player is interpreted.
 */
public enum InputMode {
    IDLE,
    AWAITING_NOTE,
    AWAITING_PROCRASTINATION_REPLY
}
