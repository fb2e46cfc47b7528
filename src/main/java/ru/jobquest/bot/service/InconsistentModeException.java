package ru.jobquest.bot.service;

import ru.jobquest.bot.model.InputMode;

/**
 * Input arrived while the player was in a different conversation mode.
 */
public class InconsistentModeException extends ProgressionException {
    private final InputMode expected;
    private final InputMode actual;

    public InconsistentModeException(InputMode expected, InputMode actual) {
        super("Expected mode " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public InputMode expected() { return expected; }
    public InputMode actual() { return actual; }
}
