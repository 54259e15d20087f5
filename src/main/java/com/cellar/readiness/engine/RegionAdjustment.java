package com.cellar.readiness.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Signed axis deltas for wines from a region, matched by substring.
 */
@Value
@Builder
public class RegionAdjustment {
    @Singular
    List<String> keywords;
    int bodyDelta;
    int tanninDelta;
    int acidityDelta;
    int oakDelta;
    int sweetnessDelta;

    public boolean matches(String normalizedRegion) {
        for (String keyword : keywords) {
            if (normalizedRegion.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    void applyTo(int[] axes) {
        axes[0] += bodyDelta;
        axes[1] += tanninDelta;
        axes[2] += acidityDelta;
        axes[3] += oakDelta;
        axes[4] += sweetnessDelta;
    }
}
