package ru.jobquest.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;
import ru.jobquest.bot.config.Config;
import ru.jobquest.bot.db.Database;
import ru.jobquest.bot.db.Schema;
import ru.jobquest.bot.scheduler.ReminderScheduler;
import ru.jobquest.bot.service.ActionRouter;
import ru.jobquest.bot.service.PlayerStateManager;
import ru.jobquest.bot.service.QuestCatalog;
import ru.jobquest.bot.store.PlayerStore;
import ru.jobquest.bot.store.SqlitePlayerStore;
import ru.jobquest.bot.telegram.JobQuestBot;

import java.security.SecureRandom;
import java.time.Clock;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        Config cfg = Config.load();

        Database db = new Database(cfg.dbPath());
        Schema.migrate(db);
        log.info("Database: {}", db.path());

        Clock clock = Clock.systemUTC();
        PlayerStore store = new SqlitePlayerStore(db);
        // fail fast if the store is unreadable
        int known = store.listUserIds().size();
        log.info("Players on record: {}", known);

        PlayerStateManager players = new PlayerStateManager(store, clock);
        ActionRouter actions = new ActionRouter(players, QuestCatalog.defaults(), clock, new SecureRandom(), cfg.penaltyXp());

        JobQuestBot bot = new JobQuestBot(cfg, actions);

        TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
        api.registerBot(bot);
        bot.registerCommands();

        ReminderScheduler scheduler = new ReminderScheduler(
                players,
                bot,
                clock,
                cfg.reminderInterval(),
                cfg.reminderGrace(),
                cfg.penaltyXp(),
                cfg.schedulerTick(),
                cfg.schedulerLockWait()
        );
        scheduler.start();
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::stop, "jobquest-shutdown"));

        log.info("JobQuest bot started as @{}", cfg.botUsername());
    }
}
