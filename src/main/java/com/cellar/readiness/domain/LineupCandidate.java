package com.cellar.readiness.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A bottle that could be opened tonight, with what is already known about it.
 */
@Value
@Builder
public class LineupCandidate {
    Long bottleId;
    Long wineId;
    String wineName;
    Integer vintageYear;
    WineColor color;
    int quantity;
    Double rating;
    ReadinessResult readiness;
    StructuralProfile profile;

    public boolean isInStock() {
        return quantity > 0;
    }

    public double ratingOrZero() {
        return rating != null ? rating : 0.0;
    }

    public int readinessScoreOrZero() {
        return readiness != null ? readiness.getScore() : 0;
    }

    public int powerOrZero() {
        return profile != null ? profile.getPower() : 0;
    }
}
