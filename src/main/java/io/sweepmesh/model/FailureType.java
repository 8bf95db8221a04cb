package io.sweepmesh.model;

import java.util.Locale;

/**
 * Classification attached to a failed attempt. Wire names are the lower-case constant names.
 */
public enum FailureType {
    TIMING,
    MODAL,
    SESSION,
    BROWSER,
    PERMANENT,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Browser failures also force the worker handle to be recreated.
     */
    public boolean requiresRestart() {
        return this == BROWSER;
    }

    public static FailureType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (FailureType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
