package ru.jobquest.bot.service;

public class InvalidQuestException extends ProgressionException {
    private final String questId;

    public InvalidQuestException(String questId) {
        super("Unknown quest: " + questId);
        this.questId = questId;
    }

    public String questId() {
        return questId;
    }
}
