package com.cellar.readiness.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Typical structure of a grape variety. Null axes leave the color baseline untouched.
 */
@Value
@Builder
public class GrapeProfileRule {
    @Singular
    List<String> keywords;
    Integer body;
    Integer tannin;
    Integer acidity;
    Integer oak;
    Integer sweetness;
    String agingNote;

    public boolean matches(String normalizedGrape) {
        for (String keyword : keywords) {
            if (normalizedGrape.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    void applyTo(int[] axes) {
        if (body != null) axes[0] = body;
        if (tannin != null) axes[1] = tannin;
        if (acidity != null) axes[2] = acidity;
        if (oak != null) axes[3] = oak;
        if (sweetness != null) axes[4] = sweetness;
    }
}
