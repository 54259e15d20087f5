package com.cellar.readiness.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of a readiness computation for one wine.
 * Drink window years are null only when the status is UNKNOWN.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReadinessResult {
    int score;
    ReadinessStatus status;
    Integer drinkWindowStart;
    Integer drinkWindowEnd;
    Confidence confidence;
    @Singular
    List<String> reasons;
    int algorithmVersion;
}
