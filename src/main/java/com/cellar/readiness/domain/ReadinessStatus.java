package com.cellar.readiness.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Drinking readiness of a wine at a given year.
 * UNKNOWN is only produced for missing or implausible vintages.
 */
public enum ReadinessStatus {
    TOO_YOUNG("TooYoung"),
    APPROACHING("Approaching"),
    PEAK("Peak"),
    IN_WINDOW("InWindow"),
    PAST_PEAK("PastPeak"),
    READY_NOW("ReadyNow"),
    UNKNOWN("Unknown");

    private final String label;

    ReadinessStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isDrinkable() {
        return this == PEAK || this == IN_WINDOW || this == READY_NOW;
    }
}
