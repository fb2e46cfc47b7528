package ru.jobquest.bot.service;

/**
 * Base of the recoverable errors a progression call can end with. None of them
 * leaves a partial change behind.
 */
public class ProgressionException extends RuntimeException {
    public ProgressionException(String message) {
        super(message);
    }

    public ProgressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
