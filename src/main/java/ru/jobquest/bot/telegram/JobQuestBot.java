package ru.jobquest.bot.telegram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import ru.jobquest.bot.config.Config;
import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.InputMode;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.scheduler.ReminderListener;
import ru.jobquest.bot.service.ActionRouter;
import ru.jobquest.bot.service.InconsistentModeException;
import ru.jobquest.bot.service.InvalidQuestException;
import ru.jobquest.bot.service.StorageFailureException;
import ru.jobquest.bot.util.TextChunker;

import java.util.List;

/**
 * Telegram side of the bot. In private chats the chat id equals the user id,
 * which is what outbound reminders rely on.
 */
public final class JobQuestBot extends TelegramLongPollingBot implements ReminderListener {
    private static final Logger log = LoggerFactory.getLogger(JobQuestBot.class);

    private final Config cfg;
    private final ActionRouter actions;

    public JobQuestBot(Config cfg, ActionRouter actions) {
        super(cfg.botToken());
        this.cfg = cfg;
        this.actions = actions;
    }

    /** Best-effort, the bot works without the command list. */
    public void registerCommands() {
        try {
            execute(new SetMyCommands(List.of(
                    new BotCommand("/start", "Открыть меню"),
                    new BotCommand("/help", "Помощь")
            ), null, null));
        } catch (TelegramApiException e) {
            log.warn("Could not set bot commands: {}", e.getMessage());
        }
    }

    @Override
    public String getBotUsername() {
        return cfg.botUsername();
    }

    @Override
    public void onUpdateReceived(Update update) {
        try {
            if (update.hasCallbackQuery()) {
                onCallback(update.getCallbackQuery());
                return;
            }
            if (update.hasMessage()) {
                onMessage(update.getMessage());
            }
        } catch (StorageFailureException e) {
            log.error("Storage failure while handling update {}", update.getUpdateId(), e);
            Long chatId = chatOf(update);
            if (chatId != null) sendHtml(chatId, Messages.STORAGE_FAILED, Keyboards.mainMenu());
        } catch (Exception e) {
            log.error("Failed to handle update {}", update.getUpdateId(), e);
        }
    }

    private void onMessage(Message msg) {
        if (msg.getFrom() == null) return;
        long userId = msg.getFrom().getId();
        long chatId = msg.getChatId();

        String text = msg.getText();
        if (text == null) return;

        if (text.startsWith("/start")) {
            actions.profile(userId);
            sendHtml(chatId, Messages.WELCOME, Keyboards.mainMenu());
            return;
        }
        if (text.startsWith("/help")) {
            sendHtml(chatId, Messages.help(cfg.reminderInterval(), actions.penaltyXp()), Keyboards.backOnly());
            return;
        }

        handleTextInput(userId, chatId, text.trim());
    }

    private void handleTextInput(long userId, long chatId, String text) {
        PlayerRecord r = actions.profile(userId);
        switch (r.inputMode) {
            case AWAITING_NOTE -> {
                if (text.isEmpty()) {
                    sendHtml(chatId, Messages.ASK_NOTE, Keyboards.backOnly());
                    return;
                }
                try {
                    actions.submitNote(userId, text);
                    sendHtml(chatId, Messages.NOTE_SAVED, Keyboards.mainMenu());
                } catch (InconsistentModeException e) {
                    // note mode was left in the meantime (e.g. "back" in another window)
                    sendHtml(chatId, Messages.MAIN_MENU, Keyboards.mainMenu());
                }
            }
            case AWAITING_PROCRASTINATION_REPLY ->
                    sendHtml(chatId, Messages.reminder(cfg.reminderGrace(), actions.penaltyXp()), Keyboards.reminderReply());
            case IDLE -> sendHtml(chatId, Messages.MAIN_MENU, Keyboards.mainMenu());
        }
    }

    private void onCallback(CallbackQuery cb) {
        if (cb.getFrom() == null || cb.getMessage() == null) return;
        long userId = cb.getFrom().getId();
        long chatId = cb.getMessage().getChatId();
        int msgId = cb.getMessage().getMessageId();
        String data = cb.getData();

        if (data == null) {
            answer(cb.getId(), null, false);
            return;
        }

        if (data.startsWith(CallbackData.QUEST_PREFIX)) {
            String questId = data.substring(CallbackData.QUEST_PREFIX.length());
            try {
                List<ActivityEntry> events = actions.completeQuest(userId, questId);
                editText(chatId, msgId, Messages.questResult(events), Keyboards.quests(actions.catalog().all()));
                answer(cb.getId(), "✅", false);
            } catch (InvalidQuestException e) {
                answer(cb.getId(), Messages.UNKNOWN_QUEST, true);
            } catch (InconsistentModeException e) {
                answer(cb.getId(), Messages.FINISH_NOTE_FIRST, true);
            }
            return;
        }

        switch (data) {
            case CallbackData.BACK_TO_MENU -> {
                leaveNoteMode(userId);
                editText(chatId, msgId, Messages.MAIN_MENU, Keyboards.mainMenu());
                answer(cb.getId(), null, false);
            }
            case CallbackData.MENU_PROFILE -> {
                editText(chatId, msgId, Messages.profile(actions.profile(userId)), Keyboards.mainMenu());
                answer(cb.getId(), "👤 Профиль", false);
            }
            case CallbackData.MENU_QUESTS -> {
                editText(chatId, msgId, Messages.PICK_QUEST, Keyboards.quests(actions.catalog().all()));
                answer(cb.getId(), null, false);
            }
            case CallbackData.MENU_LOG -> {
                sendLong(chatId, msgId, Messages.journal(actions.profile(userId), cfg.zoneId()), Keyboards.mainMenu());
                answer(cb.getId(), "📖 Журнал", false);
            }
            case CallbackData.MENU_NOTES -> {
                sendLong(chatId, msgId, Messages.notes(actions.profile(userId), cfg.zoneId()), Keyboards.notes());
                answer(cb.getId(), "🗒 Заметки", false);
            }
            case CallbackData.NOTE_ADD -> {
                try {
                    actions.beginNote(userId);
                    editText(chatId, msgId, Messages.ASK_NOTE, Keyboards.backOnly());
                    answer(cb.getId(), null, false);
                } catch (InconsistentModeException e) {
                    answer(cb.getId(), modeHint(e), true);
                }
            }
            case CallbackData.REMINDER_WORKING -> replyToReminder(cb, chatId, msgId, false);
            case CallbackData.REMINDER_ADMIT -> replyToReminder(cb, chatId, msgId, true);
            default -> answer(cb.getId(), null, false);
        }
    }

    private void replyToReminder(CallbackQuery cb, long chatId, int msgId, boolean admits) {
        try {
            List<ActivityEntry> events = actions.replyToReminder(cb.getFrom().getId(), admits);
            String text = admits ? Messages.penalty(events) : Messages.PROGRESS_CONFIRMED;
            editText(chatId, msgId, text, Keyboards.quests(actions.catalog().all()));
            answer(cb.getId(), null, false);
        } catch (InconsistentModeException e) {
            answer(cb.getId(), Messages.REMINDER_STALE, false);
        }
    }

    private void leaveNoteMode(long userId) {
        try {
            actions.cancelInput(userId);
        } catch (InconsistentModeException e) {
            // a pending reminder stays pending
            log.debug("Player {} keeps mode {}", userId, e.actual());
        }
    }

    private static String modeHint(InconsistentModeException e) {
        return e.actual() == InputMode.AWAITING_PROCRASTINATION_REPLY
                ? "⏰ Сначала ответь на напоминание"
                : Messages.FINISH_NOTE_FIRST;
    }

    // --- ReminderListener ---

    @Override
    public void deliverReminder(long userId) {
        if (sendHtml(userId, Messages.reminder(cfg.reminderGrace(), actions.penaltyXp()), Keyboards.reminderReply()) == null) {
            log.warn("Reminder for player {} was not delivered", userId);
        }
    }

    @Override
    public void penaltyApplied(long userId, List<ActivityEntry> events) {
        sendHtml(userId, Messages.penalty(events), Keyboards.mainMenu());
    }

    // --- send helpers ---

    public Message sendHtml(long chatId, String text, InlineKeyboardMarkup kb) {
        SendMessage m = new SendMessage();
        m.setChatId(chatId);
        m.setText(limit(text));
        m.setParseMode(ParseMode.HTML);
        if (kb != null) m.setReplyMarkup(kb);
        try {
            return execute(m);
        } catch (TelegramApiException e) {
            log.warn("sendMessage to {} failed: {}", chatId, e.getMessage());
            return null;
        }
    }

    public void editText(long chatId, int messageId, String text, InlineKeyboardMarkup kb) {
        EditMessageText em = new EditMessageText();
        em.setChatId(chatId);
        em.setMessageId(messageId);
        em.setText(limit(text));
        em.setParseMode(ParseMode.HTML);
        if (kb != null) em.setReplyMarkup(kb);
        try {
            execute(em);
        } catch (TelegramApiException e) {
            // "message is not modified" lands here too
            log.debug("editMessageText {}:{} failed: {}", chatId, messageId, e.getMessage());
        }
    }

    /** First chunk replaces the menu message, the rest follow as new messages; keyboard goes on the last one. */
    private void sendLong(long chatId, int messageId, String text, InlineKeyboardMarkup kb) {
        List<String> chunks = TextChunker.splitByLines(text, cfg.maxMessageLen());
        if (chunks.isEmpty()) return;
        if (chunks.size() == 1) {
            editText(chatId, messageId, chunks.get(0), kb);
            return;
        }
        editText(chatId, messageId, chunks.get(0), null);
        for (int i = 1; i < chunks.size(); i++) {
            sendHtml(chatId, chunks.get(i), i == chunks.size() - 1 ? kb : null);
        }
    }

    private void answer(String cbId, String text, boolean alert) {
        AnswerCallbackQuery a = new AnswerCallbackQuery();
        a.setCallbackQueryId(cbId);
        if (text != null) a.setText(text);
        a.setShowAlert(alert);
        try {
            execute(a);
        } catch (TelegramApiException e) {
            log.debug("answerCallbackQuery failed: {}", e.getMessage());
        }
    }

    private String limit(String text) {
        if (text == null) return "";
        if (text.length() <= cfg.maxMessageLen()) return text;
        return text.substring(0, TextChunker.safeCut(text, cfg.maxMessageLen() - 3)) + "...";
    }

    private static Long chatOf(Update u) {
        if (u.hasMessage()) return u.getMessage().getChatId();
        if (u.hasCallbackQuery() && u.getCallbackQuery().getMessage() != null) {
            return u.getCallbackQuery().getMessage().getChatId();
        }
        return null;
    }
}
