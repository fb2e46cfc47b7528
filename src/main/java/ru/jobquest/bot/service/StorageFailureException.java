package ru.jobquest.bot.service;

/**
 * The store did not complete a read or write. The in-memory record is left as it
 * was before the call, so the whole call may simply be retried.
 */
public class StorageFailureException extends ProgressionException {
    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
