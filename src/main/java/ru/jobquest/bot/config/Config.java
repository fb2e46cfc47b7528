package ru.jobquest.bot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

public final class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private final String botToken;
    private final String botUsername;
    private final Path dbPath;
    private final ZoneId zoneId;

    // Accountability
    private final Duration reminderInterval;
    private final Duration reminderGrace;
    private final long penaltyXp;

    // Scheduler
    private final Duration schedulerTick;
    private final Duration schedulerLockWait;

    private final int maxMessageLen;

    public Config(
            String botToken,
            String botUsername,
            Path dbPath,
            ZoneId zoneId,
            Duration reminderInterval,
            Duration reminderGrace,
            long penaltyXp,
            Duration schedulerTick,
            Duration schedulerLockWait,
            int maxMessageLen
    ) {
        this.botToken = Objects.requireNonNull(botToken);
        this.botUsername = Objects.requireNonNull(botUsername);
        this.dbPath = Objects.requireNonNull(dbPath);
        this.zoneId = Objects.requireNonNull(zoneId);
        this.reminderInterval = requirePositive(reminderInterval, "reminderInterval");
        this.reminderGrace = requirePositive(reminderGrace, "reminderGrace");
        this.schedulerTick = requirePositive(schedulerTick, "schedulerTick");
        this.schedulerLockWait = Objects.requireNonNull(schedulerLockWait);
        if (penaltyXp <= 0) throw new IllegalArgumentException("penaltyXp must be positive: " + penaltyXp);
        this.penaltyXp = penaltyXp;
        this.maxMessageLen = maxMessageLen;
    }

    public static Config load() {
        String botToken = get("BOT_TOKEN", "");
        String botUsername = get("BOT_USERNAME", "jobquest_bot");
        String dbPath = get("DB_PATH", "./data/jobquest.db");
        String tz = get("BOT_TIMEZONE", "Europe/Moscow");

        int intervalMinutes = getInt("REMINDER_INTERVAL_MINUTES", 15);
        // grace defaults to one more interval
        int graceMinutes = getInt("REMINDER_GRACE_MINUTES", intervalMinutes);
        int tickSeconds = getInt("SCHEDULER_TICK_SECONDS", intervalMinutes * 60);
        int lockWaitMs = getInt("SCHEDULER_LOCK_WAIT_MS", 500);
        int penaltyXp = getInt("PENALTY_XP", 20);
        int maxLen = getInt("MAX_MESSAGE_LEN", 3900);

        if (botToken.isBlank()) {
            log.warn("BOT_TOKEN is empty. Set env BOT_TOKEN or VM option -DBOT_TOKEN=...");
        }

        return new Config(
                botToken,
                botUsername,
                Path.of(dbPath),
                ZoneId.of(tz),
                Duration.ofMinutes(intervalMinutes),
                Duration.ofMinutes(graceMinutes),
                penaltyXp,
                Duration.ofSeconds(tickSeconds),
                Duration.ofMillis(lockWaitMs),
                maxLen
        );
    }

    private static String get(String key, String def) {
        String env = System.getenv(key);
        if (env != null && !env.isBlank()) return env;
        String prop = System.getProperty(key);
        if (prop != null && !prop.isBlank()) return prop;
        return def;
    }

    private static int getInt(String key, int def) {
        String v = get(key, "");
        if (v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("{}={} is not a number, using {}", key, v, def);
            return def;
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive: " + d);
        return d;
    }

    public String botToken() { return botToken; }
    public String botUsername() { return botUsername; }
    public Path dbPath() { return dbPath; }
    public ZoneId zoneId() { return zoneId; }

    public Duration reminderInterval() { return reminderInterval; }
    public Duration reminderGrace() { return reminderGrace; }
    public long penaltyXp() { return penaltyXp; }

    public Duration schedulerTick() { return schedulerTick; }
    public Duration schedulerLockWait() { return schedulerLockWait; }
    public int maxMessageLen() { return maxMessageLen; }
}
