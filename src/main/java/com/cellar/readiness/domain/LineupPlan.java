package com.cellar.readiness.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ordered tasting sequence, light to bold.
 * bestEffort is set when some adjacent step still exceeds the jarring threshold.
 */
@Value
@Builder
public class LineupPlan {
    List<LineupSlot> slots;
    int targetCount;
    int largestPowerStep;
    boolean bestEffort;
}
