package ru.jobquest.bot.model;

import java.time.Instant;

public record Note(Instant at, String text) {
}
