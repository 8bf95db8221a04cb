package io.sweepmesh.model;

import java.util.Locale;

public enum RunMode {
    SWEEP,
    GRID,
    STAGED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SWEEP;
        }
        for (RunMode value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown run mode: " + raw);
    }
}
