package ru.jobquest.bot.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long journal / notes listings into Telegram-sized messages.
 */
public final class TextChunker {

    private TextChunker() {}

    public static List<String> splitByLines(String text, int maxLen) {
        if (maxLen <= 0) throw new IllegalArgumentException("maxLen must be positive");
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        if (text.length() <= maxLen) {
            out.add(text);
            return out;
        }
        StringBuilder cur = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            // a single line longer than the limit is cut hard, but never inside an entity or a tag
            while (line.length() > maxLen) {
                if (cur.length() > 0) {
                    out.add(cur.toString());
                    cur.setLength(0);
                }
                int cut = safeCut(line, maxLen);
                out.add(line.substring(0, cut));
                line = line.substring(cut);
            }
            if (cur.length() > 0 && cur.length() + line.length() + 1 > maxLen) {
                out.add(cur.toString());
                cur.setLength(0);
            }
            if (cur.length() > 0) cur.append("\n");
            cur.append(line);
        }
        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }

    /**
     * Largest index {@code <= maxLen} that does not split an HTML entity ({@code &amp;})
     * or tag ({@code <b>}) open before it. Falls back to {@code maxLen} when the
     * markup alone is longer than the limit.
     */
    public static int safeCut(String text, int maxLen) {
        if (text.length() <= maxLen) return text.length();
        int cut = maxLen;
        int amp = text.lastIndexOf('&', cut - 1);
        if (amp >= 0 && text.indexOf(';', amp) >= cut) cut = amp;
        int lt = text.lastIndexOf('<', cut - 1);
        if (lt >= 0 && text.indexOf('>', lt) >= cut) cut = lt;
        return cut > 0 ? cut : maxLen;
    }
}
