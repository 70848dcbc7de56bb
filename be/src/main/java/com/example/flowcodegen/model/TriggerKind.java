package com.example.flowcodegen.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Entry-point kind of a trigger node. The editor sends {@code cron} for scheduled triggers.
 */
public enum TriggerKind {
    SCHEDULED,
    WEBHOOK;

    public static Optional<TriggerKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("cron".equals(normalized) || "scheduled".equals(normalized)) {
            return Optional.of(SCHEDULED);
        }
        if ("webhook".equals(normalized)) {
            return Optional.of(WEBHOOK);
        }
        return Optional.empty();
    }
}
