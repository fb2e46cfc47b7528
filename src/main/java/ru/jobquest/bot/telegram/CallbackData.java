package ru.jobquest.bot.telegram;

/**
 * Callback-data should be <= 64 bytes.
 * We keep it compact and parse by prefixes.
 */
public final class CallbackData {
    private CallbackData() {}

    public static final String BACK_TO_MENU = "m:back";

    // Main menu
    public static final String MENU_PROFILE = "m:p";
    public static final String MENU_QUESTS = "m:q";
    public static final String MENU_LOG = "m:l";
    public static final String MENU_NOTES = "m:n";

    public static final String QUEST_PREFIX = "q:"; // + quest id

    public static final String NOTE_ADD = "n:add";

    // Reminder replies
    public static final String REMINDER_WORKING = "r:ok";
    public static final String REMINDER_ADMIT = "r:lazy";
}
