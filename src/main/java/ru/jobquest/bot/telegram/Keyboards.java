package ru.jobquest.bot.telegram;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import ru.jobquest.bot.model.Quest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Keyboards {

    private Keyboards() {}

    public static InlineKeyboardButton btn(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton();
        b.setText(text);
        b.setCallbackData(data);
        return b;
    }

    public static InlineKeyboardMarkup rows(List<List<InlineKeyboardButton>> rows) {
        InlineKeyboardMarkup m = new InlineKeyboardMarkup();
        m.setKeyboard(rows);
        return m;
    }

    @SafeVarargs
    public static InlineKeyboardMarkup ofRows(List<InlineKeyboardButton>... rows) {
        return rows(new ArrayList<>(Arrays.asList(rows)));
    }

    public static InlineKeyboardMarkup mainMenu() {
        return ofRows(
                List.of(btn("👤 Профиль", CallbackData.MENU_PROFILE), btn("📜 Квесты", CallbackData.MENU_QUESTS)),
                List.of(btn("📖 Журнал", CallbackData.MENU_LOG), btn("🗒 Заметки", CallbackData.MENU_NOTES))
        );
    }

    /** Two quests per row, then the back button. */
    public static InlineKeyboardMarkup quests(List<Quest> quests) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (int i = 0; i < quests.size(); i += 2) {
            List<InlineKeyboardButton> r = new ArrayList<>();
            for (int j = i; j < i + 2 && j < quests.size(); j++) {
                Quest q = quests.get(j);
                r.add(btn(q.label(), CallbackData.QUEST_PREFIX + q.id()));
            }
            rows.add(r);
        }
        rows.add(List.of(btn("⬅️ Назад", CallbackData.BACK_TO_MENU)));
        return rows(rows);
    }

    public static InlineKeyboardMarkup notes() {
        return ofRows(
                List.of(btn("➕ Добавить заметку", CallbackData.NOTE_ADD)),
                List.of(btn("⬅️ Назад", CallbackData.BACK_TO_MENU))
        );
    }

    public static InlineKeyboardMarkup reminderReply() {
        return ofRows(
                List.of(btn("💪 Работаю", CallbackData.REMINDER_WORKING)),
                List.of(btn("😔 Прокрастинировал", CallbackData.REMINDER_ADMIT))
        );
    }

    public static InlineKeyboardMarkup backOnly() {
        return ofRows(List.of(btn("⬅️ Назад", CallbackData.BACK_TO_MENU)));
    }
}
