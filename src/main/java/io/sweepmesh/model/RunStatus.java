package io.sweepmesh.model;

import java.util.Locale;

public enum RunStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(RunStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == PAUSED || next == COMPLETED || next == FAILED;
            case PAUSED -> next == RUNNING || next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public static RunStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("run status is required");
        }
        for (RunStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + raw);
    }
}
