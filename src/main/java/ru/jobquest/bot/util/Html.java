package ru.jobquest.bot.util;

/**
 * Helpers for Telegram's HTML parse mode.
 */
public final class Html {
    private Html() {}

    public static String esc(String s) {
        if (s == null) return "";
        return s
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    public static String b(Object v) {
        return "<b>" + esc(String.valueOf(v)) + "</b>";
    }
}
