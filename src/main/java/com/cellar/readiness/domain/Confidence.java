package com.cellar.readiness.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Confidence {
    LOW("low"),
    MED("med"),
    HIGH("high");

    private final String value;

    Confidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * The less certain of two confidences.
     */
    public Confidence min(Confidence other) {
        if (other == null) {
            return this;
        }
        return ordinal() <= other.ordinal() ? this : other;
    }

    @JsonCreator
    public static Confidence fromString(String raw) {
        if (raw == null) {
            return LOW;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "high":
                return HIGH;
            case "med":
            case "medium":
                return MED;
            default:
                return LOW;
        }
    }
}
