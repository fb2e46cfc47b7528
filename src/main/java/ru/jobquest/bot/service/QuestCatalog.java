package ru.jobquest.bot.service;

import ru.jobquest.bot.model.Quest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class QuestCatalog {

    private final Map<String, Quest> quests;

    public QuestCatalog(List<Quest> quests) {
        Map<String, Quest> m = new LinkedHashMap<>();
        for (Quest q : quests) {
            if (m.putIfAbsent(q.id(), q) != null) {
                throw new IllegalArgumentException("Duplicate quest id: " + q.id());
            }
        }
        this.quests = Collections.unmodifiableMap(m);
    }

    public static QuestCatalog defaults() {
        return new QuestCatalog(List.of(
                new Quest("apply", "💼", "Отклик на вакансию", 50, 1, 2),
                new Quest("study", "🧠", "Учёба", 15, 0, 1),
                new Quest("resume", "📄", "Обновить резюме", 30, 0, 1),
                new Quest("recruiter", "✉️", "Написать рекрутеру", 25, 1, 2),
                new Quest("project", "🛠️", "Пет-проект", 50, 0, 1)
        ));
    }

    public Optional<Quest> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(quests.get(id));
    }

    public Quest require(String id) {
        return find(id).orElseThrow(() -> new InvalidQuestException(id));
    }

    public List<Quest> all() {
        return List.copyOf(quests.values());
    }
}
