package com.cellar.readiness.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BackfillStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
