package com.cellar.readiness.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a structural profile came from.
 */
public enum ProfileOrigin {
    AI("ai"),
    HEURISTIC("heuristic");

    private final String value;

    ProfileOrigin(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
