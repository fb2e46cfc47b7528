package ru.jobquest.bot.telegram;

import ru.jobquest.bot.model.ActivityEntry;
import ru.jobquest.bot.model.Note;
import ru.jobquest.bot.model.PlayerRecord;
import ru.jobquest.bot.service.ProgressionEngine;
import ru.jobquest.bot.util.Html;
import ru.jobquest.bot.util.TimeUtil;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * HTML texts of the bot.
 */
final class Messages {

    private Messages() {}

    static final String WELCOME = "🎮 <b>Поиск работы — MMORPG</b>\n\nЗакрывай квесты, копи опыт и золото.";
    static final String MAIN_MENU = "🏠 <b>Главное меню</b>";
    static final String PICK_QUEST = "📜 <b>Выбери квест</b>";
    static final String ASK_NOTE = "✍️ Напиши текст заметки одним сообщением";
    static final String NOTE_SAVED = "✅ Заметка сохранена";
    static final String STORAGE_FAILED = "⚠️ Не удалось сохранить прогресс. Попробуй ещё раз.";
    static final String FINISH_NOTE_FIRST = "✍️ Сначала допиши заметку или нажми «Назад»";
    static final String REMINDER_STALE = "Напоминание уже неактуально 👌";
    static final String UNKNOWN_QUEST = "⚠️ Такого квеста нет";
    static final String PROGRESS_CONFIRMED = "👍 Отлично! Закрой квест, чтобы это засчиталось.";

    static String help(Duration interval, long penaltyXp) {
        return "🆘 <b>Как это работает</b>\n\n" +
                "1) Закрывай квесты в меню «📜 Квесты» и получай XP и золото.\n" +
                "2) Если " + minutes(interval) + " мин. не было ни одного квеста, я спрошу, как дела.\n" +
                "3) Не ответишь вовремя или признаешься в прокрастинации: −" + penaltyXp + " XP.\n" +
                "   Уровень при этом не теряется.\n\n" +
                "Команды:\n" +
                "• /start — меню\n" +
                "• /help — помощь";
    }

    static String profile(PlayerRecord r) {
        ProgressionEngine.LevelInfo lvl = ProgressionEngine.levelInfo(r);
        return "👤 <b>Профиль</b>\n\n" +
                "Уровень: " + Html.b(r.level) + "\n" +
                "XP: " + Html.b(r.xp) + " / " + lvl.to() + " (ещё " + lvl.remaining(r.xp) + ")\n" +
                "💰 Золото: " + Html.b(r.gold);
    }

    static String questResult(List<ActivityEntry> events) {
        StringBuilder sb = new StringBuilder();
        for (ActivityEntry e : events) {
            switch (e.kind()) {
                case QUEST_COMPLETED -> {
                    sb.append("✅ ").append(Html.b(e.questName())).append("\n+").append(e.xpDelta()).append(" XP");
                    if (e.goldDelta() > 0) sb.append(", +").append(e.goldDelta()).append(" золота");
                    sb.append("\n");
                }
                case LEVEL_UP -> sb.append("🆙 Новый уровень ").append(Html.b(e.level())).append("\n");
                case PENALTY_APPLIED -> sb.append("💀 ").append(e.xpDelta()).append(" XP\n");
            }
        }
        return sb.toString().strip();
    }

    static String reminder(Duration grace, long penaltyXp) {
        return "⏰ <b>Давно не было квестов!</b>\n\n" +
                "Ты работаешь над поиском или прокрастинируешь?\n" +
                "Ответь в течение " + minutes(grace) + " мин., иначе −" + penaltyXp + " XP.";
    }

    static String penalty(List<ActivityEntry> events) {
        long lost = 0;
        for (ActivityEntry e : events) lost += e.xpDelta();
        return "💀 <b>Штраф</b>: " + lost + " XP\nЗакрой квест, чтобы вернуться в строй.";
    }

    /** Newest entries first, as the journal was always shown. */
    static String journal(PlayerRecord r, ZoneId zone) {
        StringBuilder sb = new StringBuilder("📖 <b>Журнал</b>\n\n");
        if (r.activityLog.isEmpty()) return sb.append("Пока пусто").toString();
        for (int i = r.activityLog.size() - 1; i >= 0; i--) {
            sb.append(entryLine(r.activityLog.get(i), zone)).append("\n");
        }
        return sb.toString().strip();
    }

    static String entryLine(ActivityEntry e, ZoneId zone) {
        String ts = TimeUtil.fmt(e.at(), zone);
        return switch (e.kind()) {
            case QUEST_COMPLETED -> ts + " — ✅ " + Html.esc(e.questName()) + " (+" + e.xpDelta() + " XP"
                    + (e.goldDelta() > 0 ? ", +" + e.goldDelta() + " золота" : "") + ")";
            case LEVEL_UP -> ts + " — 🆙 Новый уровень " + e.level();
            case PENALTY_APPLIED -> ts + " — 💀 Штраф " + e.xpDelta() + " XP";
        };
    }

    static String notes(PlayerRecord r, ZoneId zone) {
        StringBuilder sb = new StringBuilder("🗒 <b>Заметки</b>\n\n");
        if (r.notes.isEmpty()) return sb.append("Пока нет заметок").toString();
        for (int i = r.notes.size() - 1; i >= 0; i--) {
            Note n = r.notes.get(i);
            sb.append(TimeUtil.fmt(n.at(), zone)).append(" — ").append(Html.esc(n.text())).append("\n");
        }
        return sb.toString().strip();
    }

    private static long minutes(Duration d) {
        return d.toMinutes();
    }
}
