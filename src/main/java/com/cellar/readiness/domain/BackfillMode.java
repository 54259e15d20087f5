package com.cellar.readiness.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which wine rows a backfill job recomputes.
 */
public enum BackfillMode {
    /** Rows with no readiness result at all. */
    MISSING_ONLY("missing_only"),
    /** Missing rows plus rows computed by another algorithm version. */
    STALE_OR_MISSING("stale_or_missing"),
    /** Every row. */
    FORCE_ALL("force_all");

    private final String value;

    BackfillMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BackfillMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MISSING_ONLY;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (BackfillMode mode : values()) {
            if (mode.value.equals(normalized) || mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown backfill mode: " + raw);
    }
}
