package me.golemcore.runstream.domain.model;

import java.util.Locale;

/**
 * Lifecycle status of a remote run, as reported by the agent backend.
 */
public enum RunStatus {

    QUEUED,
    IN_PROGRESS,
    REQUIRES_ACTION,
    CANCELLING,
    CANCELLED,
    FAILED,
    COMPLETED,
    INCOMPLETE,
    EXPIRED;

    public boolean isTerminal() {
        return this == CANCELLED || this == FAILED || this == COMPLETED || this == INCOMPLETE || this == EXPIRED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a provider status string such as {@code in_progress}. Returns
     * null for unknown values.
     */
    public static RunStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
