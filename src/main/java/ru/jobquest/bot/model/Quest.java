package ru.jobquest.bot.model;

import java.util.Objects;

/**
 * Catalog entry. {@code id} is the compact key used in callback data.
 */
public record Quest(String id, String emoji, String name, long xpReward, long goldMin, long goldMax) {

    public Quest {
        Objects.requireNonNull(id);
        Objects.requireNonNull(name);
        if (xpReward < 0) throw new IllegalArgumentException("xpReward < 0: " + id);
        if (goldMin < 0 || goldMax < goldMin) {
            throw new IllegalArgumentException("bad gold range " + goldMin + ".." + goldMax + ": " + id);
        }
    }

    public String label() {
        return emoji + " " + name;
    }
}
