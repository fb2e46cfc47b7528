package ru.jobquest.bot.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class TimeUtil {
    private TimeUtil() {}

    public static final DateTimeFormatter SHORT = DateTimeFormatter.ofPattern("dd.MM HH:mm");

    public static String fmt(Instant at, ZoneId zone) {
        if (at == null) return "—";
        return SHORT.format(at.atZone(zone));
    }
}
