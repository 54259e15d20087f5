package com.cellar.readiness.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Wine color as stored on the wine row.
 */
public enum WineColor {
    RED("red"),
    WHITE("white"),
    ROSE("rose"),
    SPARKLING("sparkling");

    private final String value;

    WineColor(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient parse of free-text colors ("Rosé", "Sparkling white", "RED").
     * Unknown or blank input is treated as red.
     */
    @JsonCreator
    public static WineColor fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return RED;
        }
        String normalized = raw.toLowerCase(Locale.ROOT).replace('é', 'e');
        if (normalized.contains("sparkling") || normalized.contains("champagne")) {
            return SPARKLING;
        }
        if (normalized.contains("rose")) {
            return ROSE;
        }
        if (normalized.contains("white")) {
            return WHITE;
        }
        return RED;
    }
}
